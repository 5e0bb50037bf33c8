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
import org.eventfold.application.converter.DecodedEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.eventfold.cloudevents.EventfoldExtensionGetter.getStreamRevision;

/**
 * Folds the events of a single stream into the current state of an aggregate.
 * <p>
 * The {@code evolve} function is called once per recognized event, in stream order, and is passed {@code null}
 * as state for the first one. Events whose type is unknown to the converter are logged and skipped, they leave the state
 * unchanged but still count as observed when it comes to {@link AggregateResult#lastRevision()}.
 * </p>
 * Aggregating is free of side effects, the caller supplies the events.
 *
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public class StreamAggregator<S, E> {
    private static final Logger log = LoggerFactory.getLogger(StreamAggregator.class);

    private final CloudEventConverter<E> cloudEventConverter;
    private final BiFunction<@Nullable S, E, S> evolve;

    public StreamAggregator(CloudEventConverter<E> cloudEventConverter, BiFunction<@Nullable S, E, S> evolve) {
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        this.cloudEventConverter = cloudEventConverter;
        this.evolve = evolve;
    }

    public AggregateResult<S> aggregate(Stream<CloudEvent> events) {
        return aggregate(AggregateResult.empty(), events);
    }

    /**
     * Continue folding from a previous result.
     *
     * @param previous The result of folding the events that precede {@code events}
     * @param events   The events to fold, in stream order
     * @return The result of folding {@code events} on top of {@code previous}
     */
    public AggregateResult<S> aggregate(AggregateResult<S> previous, Stream<CloudEvent> events) {
        requireNonNull(previous, "Previous result cannot be null");
        requireNonNull(events, "Events cannot be null");
        S state = previous.state();
        long lastRevision = previous.lastRevision();
        for (Iterator<CloudEvent> iterator = events.iterator(); iterator.hasNext(); ) {
            CloudEvent cloudEvent = iterator.next();
            DecodedEvent<E> decoded = cloudEventConverter.toDomainEvent(cloudEvent);
            if (decoded instanceof DecodedEvent.Known<E> known) {
                state = evolve.apply(state, known.event());
            } else {
                log.warn("Skipping event {} of unrecognized type {} in stream revision {}", cloudEvent.getId(), cloudEvent.getType(), getStreamRevision(cloudEvent));
            }
            lastRevision = getStreamRevision(cloudEvent);
        }
        return new AggregateResult<>(state, lastRevision);
    }
}
