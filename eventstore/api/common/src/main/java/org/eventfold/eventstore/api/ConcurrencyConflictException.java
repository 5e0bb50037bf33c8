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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The {@link ExpectedRevision} was not satisfied so no events have been written to the stream.
 * This is an optimistic locking failure: someone else appended to the stream after the caller read it.
 * It's up to the caller to decide whether to re-read and retry or to reject the command.
 */
public class ConcurrencyConflictException extends RuntimeException {
    public final String streamId;
    public final long actualRevision;
    public final ExpectedRevision expectedRevision;

    public ConcurrencyConflictException(String streamId, long actualRevision, ExpectedRevision expectedRevision) {
        this(streamId, actualRevision, expectedRevision, String.format("Expected %s of stream \"%s\" but current revision was %d.", expectedRevision, streamId, actualRevision));
    }

    public ConcurrencyConflictException(String streamId, long actualRevision, ExpectedRevision expectedRevision, String message) {
        super(message);
        this.streamId = streamId;
        this.actualRevision = actualRevision;
        this.expectedRevision = expectedRevision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyConflictException)) return false;
        ConcurrencyConflictException that = (ConcurrencyConflictException) o;
        return actualRevision == that.actualRevision && Objects.equals(streamId, that.streamId) && Objects.equals(expectedRevision, that.expectedRevision) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, actualRevision, expectedRevision);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("actualRevision=" + actualRevision)
                .add("expectedRevision=" + expectedRevision)
                .add("message=" + super.getMessage())
                .toString();
    }
}
