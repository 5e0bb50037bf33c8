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

import io.cloudevents.CloudEvent;
import org.eventfold.eventstore.api.ConcurrencyConflictException;
import org.eventfold.eventstore.api.ExpectedRevision;
import org.eventfold.eventstore.api.WriteResult;

import java.util.stream.Stream;

import static org.eventfold.eventstore.api.ExpectedRevision.exactly;

/**
 * Event stores that supports conditional appends to an event stream should implement this interface.
 */
public interface ConditionallyWriteToEventStream {

    /**
     * A convenience function that appends events to a stream if its current revision is equal to {@code expectedRevision}.
     *
     * @param streamId         The id of the stream
     * @param expectedRevision The stream must be at exactly this revision in order for the events to be written
     * @param events           The events to be appended to the stream
     * @return The result of the write
     * @throws ConcurrencyConflictException When the stream wasn't at the expected revision and the events couldn't be written
     * @see #write(String, ExpectedRevision, Stream)
     */
    default WriteResult write(String streamId, long expectedRevision, Stream<CloudEvent> events) {
        return write(streamId, exactly(expectedRevision), events);
    }

    /**
     * Conditionally append to a stream. All {@code events} are appended as one atomic unit, or none of them are.
     * The event store assigns each appended event its stream revision and global position.
     *
     * @param streamId         The id of the stream
     * @param expectedRevision The precondition that must be satisfied for the events to be written
     * @param events           The events to be appended to the stream
     * @return The result of the write
     * @throws ConcurrencyConflictException                                   When the <code>expectedRevision</code> was not satisfied and the events couldn't be written
     * @throws org.eventfold.eventstore.api.EventStoreUnavailableException If the event store cannot be reached
     */
    WriteResult write(String streamId, ExpectedRevision expectedRevision, Stream<CloudEvent> events);
}
