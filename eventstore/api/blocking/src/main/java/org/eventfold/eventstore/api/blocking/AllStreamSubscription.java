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

import java.time.Duration;

/**
 * A forward-only cursor over the global log. Events are delivered in global position order, each one once per cursor.
 * A cursor is used by a single thread.
 */
public interface AllStreamSubscription extends AutoCloseable {

    /**
     * Wait for the next event.
     *
     * @param timeout The maximum time to wait
     * @return The next event, or {@code null} if no event became available within {@code timeout}.
     * @throws InterruptedException If the calling thread was interrupted while waiting
     */
    CloudEvent poll(Duration timeout) throws InterruptedException;

    /**
     * @return {@code true} if every event appended so far has been delivered by this cursor.
     */
    boolean isCaughtUp();

    /**
     * Release the cursor. Subsequent calls to {@link #poll(Duration)} return {@code null}.
     */
    @Override
    void close();
}
