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

package org.eventfold.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that the event store applies to every event it appends. These are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #STREAM_ID}</td><td>The id of the stream the event belongs to</td></tr>
 *     <tr><td>{@value #STREAM_REVISION}</td><td>The zero-based revision of the event in its stream</td></tr>
 *     <tr><td>{@value #GLOBAL_POSITION}</td><td>The zero-based position of the event in the store-wide log</td></tr>
 * </table>
 */
public class EventfoldCloudEventExtension implements CloudEventExtension {
    public static final String STREAM_ID = "streamid";
    public static final String STREAM_REVISION = "streamrevision";
    public static final String GLOBAL_POSITION = "globalposition";

    static final Set<String> KEYS = Set.of(STREAM_ID, STREAM_REVISION, GLOBAL_POSITION);

    private String streamId;
    private long streamRevision;
    private long globalPosition;

    public EventfoldCloudEventExtension(String streamId, long streamRevision, long globalPosition) {
        Objects.requireNonNull(streamId, "StreamId cannot be null");
        if (streamRevision < 0) {
            throw new IllegalArgumentException("Stream revision cannot be negative");
        } else if (globalPosition < 0) {
            throw new IllegalArgumentException("Global position cannot be negative");
        }
        this.streamId = streamId;
        this.streamRevision = streamRevision;
        this.globalPosition = globalPosition;
    }

    public static EventfoldCloudEventExtension eventfold(String streamId, long streamRevision, long globalPosition) {
        return new EventfoldCloudEventExtension(streamId, streamRevision, globalPosition);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object streamId = extensions.getExtension(STREAM_ID);
        if (streamId != null) {
            this.streamId = streamId.toString();
        }

        Object streamRevision = extensions.getExtension(STREAM_REVISION);
        if (streamRevision != null) {
            this.streamRevision = ((Number) streamRevision).longValue();
        }

        Object globalPosition = extensions.getExtension(GLOBAL_POSITION);
        if (globalPosition != null) {
            this.globalPosition = ((Number) globalPosition).longValue();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        switch (key) {
            case STREAM_ID:
                return streamId;
            case STREAM_REVISION:
                return streamRevision;
            case GLOBAL_POSITION:
                return globalPosition;
            default:
                throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
        }
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
