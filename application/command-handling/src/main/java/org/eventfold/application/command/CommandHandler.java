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

import org.eventfold.eventstore.api.ConcurrencyConflictException;
import org.eventfold.eventstore.api.ExpectedRevision;
import org.eventfold.eventstore.api.WriteResult;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Executes commands against a single stream: read, fold, decide, append. Each call performs exactly one conditional
 * append of the events returned by the decision function. Nothing is retried, errors propagate to the caller:
 * <ul>
 *     <li>{@link DomainException} when the decision function rejects the command</li>
 *     <li>{@link ConcurrencyConflictException} when the expected revision no longer holds</li>
 *     <li>{@link StreamNotFoundException} when updating a stream that has no events</li>
 *     <li>{@link org.eventfold.eventstore.api.EventStoreUnavailableException} when the store cannot be reached</li>
 * </ul>
 *
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public interface CommandHandler<S, E> {

    /**
     * Start a new stream. The stream must not exist.
     *
     * @param streamId The id of the stream to create
     * @param command  The command
     * @param decision A function that returns the events that start the stream
     * @return The result of the write, {@link WriteResult#getNextExpectedRevision()} is the new revision
     */
    <C> WriteResult create(String streamId, C command, Function<C, List<E>> decision);

    /**
     * Execute a command against the current state of an existing stream.
     *
     * @param streamId         The id of the stream
     * @param command          The command
     * @param expectedRevision The revision the caller expects the stream to be at, {@code null} means {@link ExpectedRevision#any()}
     * @param decision         A function that returns the new events given the folded state and the command
     * @return The result of the write, {@link WriteResult#getNextExpectedRevision()} is the new revision
     */
    <C> WriteResult update(String streamId, C command, @Nullable ExpectedRevision expectedRevision, BiFunction<S, C, List<E>> decision);

    default <C> WriteResult update(String streamId, C command, BiFunction<S, C, List<E>> decision) {
        return update(streamId, command, null, decision);
    }

    default <C> CreateCommand<C> create(Function<C, List<E>> decision) {
        return (streamId, command) -> create(streamId, command, decision);
    }

    default <C> UpdateCommand<C> update(BiFunction<S, C, List<E>> decision) {
        return (streamId, command, expectedRevision) -> update(streamId, command, expectedRevision, decision);
    }
}
