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

/**
 * Thrown when a command is executed against a stream that has no events.
 */
public class StreamNotFoundException extends RuntimeException {
    private final String streamId;

    public StreamNotFoundException(String streamId) {
        this(streamId, "Stream \"" + streamId + "\" was not found");
    }

    public StreamNotFoundException(String streamId, String message) {
        super(message);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
