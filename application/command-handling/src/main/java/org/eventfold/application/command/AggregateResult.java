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

import org.jspecify.annotations.Nullable;

import static org.eventfold.eventstore.api.ExpectedRevision.NO_STREAM_REVISION;

/**
 * The outcome of folding a stream: the current state, and the revision of the last event that was observed.
 *
 * @param state        The folded state, {@code null} if no recognized event has been folded yet
 * @param lastRevision The revision of the last observed event, {@link org.eventfold.eventstore.api.ExpectedRevision#NO_STREAM_REVISION} if none
 * @param <S>          The type of the state
 */
public record AggregateResult<S>(@Nullable S state, long lastRevision) {

    public static <S> AggregateResult<S> empty() {
        return new AggregateResult<>(null, NO_STREAM_REVISION);
    }

    public boolean hasState() {
        return state != null;
    }

    public boolean isEmpty() {
        return lastRevision == NO_STREAM_REVISION;
    }
}
