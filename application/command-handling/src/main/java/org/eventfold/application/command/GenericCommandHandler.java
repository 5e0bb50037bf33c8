/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.application.command;

import io.cloudevents.CloudEvent;
import org.eventfold.application.converter.CloudEventConverter;
import org.eventfold.eventstore.api.ConcurrencyConflictException;
import org.eventfold.eventstore.api.ExpectedRevision;
import org.eventfold.eventstore.api.WriteResult;
import org.eventfold.eventstore.api.blocking.EventStore;
import org.eventfold.eventstore.api.blocking.EventStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CommandHandler} that reads the stream from an {@link EventStore}, folds it with a {@link StreamAggregator}
 * and writes the events returned by the decision function back, converted with a {@link CloudEventConverter}.
 * Decision functions only see the folded state, never the raw events.
 */
public class GenericCommandHandler<S, E> implements CommandHandler<S, E> {
    private static final Logger log = LoggerFactory.getLogger(GenericCommandHandler.class);

    private final EventStore eventStore;
    private final CloudEventConverter<E> cloudEventConverter;
    private final StreamAggregator<S, E> streamAggregator;

    public GenericCommandHandler(EventStore eventStore, CloudEventConverter<E> cloudEventConverter, BiFunction<@Nullable S, E, S> evolve) {
        this(eventStore, cloudEventConverter, new StreamAggregator<>(cloudEventConverter, evolve));
    }

    public GenericCommandHandler(EventStore eventStore, CloudEventConverter<E> cloudEventConverter, StreamAggregator<S, E> streamAggregator) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(streamAggregator, StreamAggregator.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.cloudEventConverter = cloudEventConverter;
        this.streamAggregator = streamAggregator;
    }

    @Override
    public <C> WriteResult create(String streamId, C command, Function<C, List<E>> decision) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(command, "Command cannot be null");
        requireNonNull(decision, "Decision function cannot be null");

        List<E> newEvents = decision.apply(command);
        return write(streamId, ExpectedRevision.noStream(), newEvents);
    }

    @Override
    public <C> WriteResult update(String streamId, C command, @Nullable ExpectedRevision expectedRevision, BiFunction<S, C, List<E>> decision) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(command, "Command cannot be null");
        requireNonNull(decision, "Decision function cannot be null");

        EventStream<CloudEvent> eventStream = eventStore.read(streamId);
        if (eventStream.isEmpty()) {
            throw new StreamNotFoundException(streamId);
        }

        AggregateResult<S> aggregate = streamAggregator.aggregate(eventStream.events());
        S state = aggregate.state();
        if (state == null) {
            throw new StreamNotFoundException(streamId, "Stream \"" + streamId + "\" contains no recognized events");
        }
        log.debug("Folded stream {} up to revision {}", streamId, aggregate.lastRevision());

        List<E> newEvents = decision.apply(state, command);
        return write(streamId, expectedRevision == null ? ExpectedRevision.any() : expectedRevision, newEvents);
    }

    private WriteResult write(String streamId, ExpectedRevision expectedRevision, List<E> newEvents) {
        requireNonNull(newEvents, "Decision function cannot return null");
        Stream<CloudEvent> cloudEvents = newEvents.stream().map(cloudEventConverter::toCloudEvent);
        try {
            WriteResult writeResult = eventStore.write(streamId, expectedRevision, cloudEvents);
            log.debug("Appended {} event(s) to stream {} expecting {}, revision is now {}", newEvents.size(), streamId, expectedRevision, writeResult.getNextExpectedRevision());
            return writeResult;
        } catch (ConcurrencyConflictException e) {
            log.debug("Concurrency conflict on stream {}: {}", streamId, e.getMessage());
            throw e;
        }
    }
}
