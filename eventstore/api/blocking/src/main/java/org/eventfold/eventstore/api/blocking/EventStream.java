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

package org.eventfold.eventstore.api.blocking;

import org.eventfold.eventstore.api.ExpectedRevision;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Represents the events of a single stream as read at a particular point in time.
 * <p>
 * {@link #events()} is re-enterable: every call replays the same events, in stream order, from the first one.
 * </p>
 */
@SuppressWarnings("NullableProblems")
public interface EventStream<T> extends Iterable<T> {

    /**
     * @return The id of the event stream
     */
    String id();

    /**
     * The revision of the last event in the stream. It is equal to {@link ExpectedRevision#NO_STREAM_REVISION} if the stream has no events.
     *
     * @return The current revision of the event stream
     * @see #isEmpty()
     */
    long revision();

    /**
     * @return A new {@link Stream} of the events, starting from revision {@code 0}.
     */
    Stream<T> events();

    @Override
    default Iterator<T> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if event stream is empty, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return revision() == ExpectedRevision.NO_STREAM_REVISION;
    }

    /**
     * @return The events in this stream as a list
     */
    default List<T> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * Apply a mapping function to the {@link EventStream}
     *
     * @param fn   The function to apply for each event.
     * @param <T2> The return type
     * @return A new {@link EventStream} where events are converted to {@code T2}.
     */
    default <T2> EventStream<T2> map(Function<T, T2> fn) {
        return new EventStream<T2>() {

            @Override
            public String id() {
                return EventStream.this.id();
            }

            @Override
            public long revision() {
                return EventStream.this.revision();
            }

            @Override
            public Stream<T2> events() {
                return EventStream.this.events().map(fn);
            }

            @Override
            public String toString() {
                return "EventStream{" +
                        "id='" + id() + '\'' +
                        ", revision=" + revision() +
                        '}';
            }
        };
    }
}
