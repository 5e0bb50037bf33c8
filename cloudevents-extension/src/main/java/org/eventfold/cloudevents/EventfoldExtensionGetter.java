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

import static org.eventfold.cloudevents.EventfoldCloudEventExtension.GLOBAL_POSITION;
import static org.eventfold.cloudevents.EventfoldCloudEventExtension.STREAM_ID;
import static org.eventfold.cloudevents.EventfoldCloudEventExtension.STREAM_REVISION;

/**
 * Utility class that gets eventfold extension values, converted to the correct type, from a {@link CloudEvent}.
 */
public class EventfoldExtensionGetter {

    /**
     * @param cloudEvent A cloud event that has {@link EventfoldCloudEventExtension} applied.
     * @return The id of the stream that the event belongs to
     */
    public static String getStreamId(CloudEvent cloudEvent) {
        Object streamId = requireExtension(cloudEvent, STREAM_ID);
        if (!(streamId instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + STREAM_ID + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) streamId;
    }

    /**
     * @param cloudEvent A cloud event that has {@link EventfoldCloudEventExtension} applied.
     * @return The zero-based revision of the event in its stream
     */
    public static long getStreamRevision(CloudEvent cloudEvent) {
        return requireLong(cloudEvent, STREAM_REVISION);
    }

    /**
     * @param cloudEvent A cloud event that has {@link EventfoldCloudEventExtension} applied.
     * @return The zero-based position of the event in the global log
     */
    public static long getGlobalPosition(CloudEvent cloudEvent) {
        return requireLong(cloudEvent, GLOBAL_POSITION);
    }

    private static long requireLong(CloudEvent cloudEvent, String key) {
        Object value = requireExtension(cloudEvent, key);
        // Integer and Long are both valid once an event has passed through a serialization round
        if (!(value instanceof Long || value instanceof Integer)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + long.class.getSimpleName());
        }
        return ((Number) value).longValue();
    }

    private static Object requireExtension(CloudEvent cloudEvent, String key) {
        if (!cloudEvent.getExtensionNames().contains(key)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }
        return cloudEvent.getExtension(key);
    }
}
