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

package org.eventfold.eventstore.api;

/**
 * A precondition, evaluated atomically by the event store, that must hold for events to be appended to a stream.
 * Revisions are zero-based, a stream that doesn't exist has revision {@value #NO_STREAM_REVISION}.
 */
public sealed interface ExpectedRevision {

    /**
     * The revision reported for a stream that has no events.
     */
    long NO_STREAM_REVISION = -1L;

    /**
     * Stream revision doesn't matter, essentially an unconditional write.
     *
     * @return An {@link ExpectedRevision} with the behavior specified above.
     */
    static ExpectedRevision any() {
        return Any.INSTANCE;
    }

    /**
     * The stream must not exist (i.e. it must have no events) for the events to be written.
     *
     * @return An {@link ExpectedRevision} with the behavior specified above.
     */
    static ExpectedRevision noStream() {
        return NoStream.INSTANCE;
    }

    /**
     * The stream must exist, regardless of its current revision.
     *
     * @return An {@link ExpectedRevision} with the behavior specified above.
     */
    static ExpectedRevision streamExists() {
        return StreamExists.INSTANCE;
    }

    /**
     * The current revision of the stream must be exactly {@code revision} for the events to be written.
     *
     * @param revision The revision of the last event in the stream that the caller has seen
     * @return An {@link ExpectedRevision} with the behavior specified above.
     */
    static ExpectedRevision exactly(long revision) {
        return new Exact(revision);
    }

    /**
     * @param currentRevision The current revision of the stream, {@value #NO_STREAM_REVISION} if it doesn't exist.
     * @return {@code true} if appending to a stream with the given revision is allowed, {@code false} otherwise.
     */
    boolean isSatisfiedBy(long currentRevision);

    default boolean isAny() {
        return this instanceof Any;
    }

    final class Any implements ExpectedRevision {
        private static final Any INSTANCE = new Any();

        private Any() {
        }

        @Override
        public boolean isSatisfiedBy(long currentRevision) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    final class NoStream implements ExpectedRevision {
        private static final NoStream INSTANCE = new NoStream();

        private NoStream() {
        }

        @Override
        public boolean isSatisfiedBy(long currentRevision) {
            return currentRevision == NO_STREAM_REVISION;
        }

        @Override
        public String toString() {
            return "no stream";
        }
    }

    final class StreamExists implements ExpectedRevision {
        private static final StreamExists INSTANCE = new StreamExists();

        private StreamExists() {
        }

        @Override
        public boolean isSatisfiedBy(long currentRevision) {
            return currentRevision > NO_STREAM_REVISION;
        }

        @Override
        public String toString() {
            return "stream exists";
        }
    }

    record Exact(long revision) implements ExpectedRevision {
        public Exact {
            if (revision < 0) {
                throw new IllegalArgumentException("Expected revision cannot be negative, was " + revision);
            }
        }

        @Override
        public boolean isSatisfiedBy(long currentRevision) {
            return currentRevision == revision;
        }

        @Override
        public String toString() {
            return "revision " + revision;
        }
    }
}
