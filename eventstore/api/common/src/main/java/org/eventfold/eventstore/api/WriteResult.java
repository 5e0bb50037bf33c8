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
 * The result of a write to the event store. The new revision is the revision of the last event in the stream after the write,
 * and is what a caller passes back as {@link ExpectedRevision#exactly(long)} on its next write to get optimistic concurrency.
 */
public class WriteResult {

    private final String streamId;
    private final long oldRevision;
    private final long newRevision;

    public WriteResult(String streamId, long oldRevision, long newRevision) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        this.streamId = streamId;
        this.oldRevision = oldRevision;
        this.newRevision = newRevision;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * @return The revision of the stream before the write, {@link ExpectedRevision#NO_STREAM_REVISION} if it didn't exist.
     */
    public long getOldRevision() {
        return oldRevision;
    }

    /**
     * @return The revision of the stream after the write
     */
    public long getNextExpectedRevision() {
        return newRevision;
    }

    /**
     * @return {@code true} if the write appended at least one event
     */
    public boolean streamChanged() {
        return oldRevision != newRevision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteResult)) return false;
        WriteResult that = (WriteResult) o;
        return oldRevision == that.oldRevision && newRevision == that.newRevision && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, oldRevision, newRevision);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("oldRevision=" + oldRevision)
                .add("newRevision=" + newRevision)
                .toString();
    }
}
