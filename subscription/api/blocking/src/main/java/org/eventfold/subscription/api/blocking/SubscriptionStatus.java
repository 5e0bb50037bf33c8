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

package org.eventfold.subscription.api.blocking;

/**
 * The lifecycle states of a checkpointed subscription.
 */
public enum SubscriptionStatus {
    /**
     * Created but not started, no consumer is attached to the log.
     */
    IDLE,
    /**
     * Processing events that were appended before the subscription reached the head of the log.
     */
    CATCHING_UP,
    /**
     * Processing events as they are appended.
     */
    LIVE,
    /**
     * A handler or the sink failed. No more events are consumed until the subscription is started again.
     */
    FAULTED,
    /**
     * Stopped on request.
     */
    STOPPED;

    public boolean isRunning() {
        return this == CATCHING_UP || this == LIVE;
    }
}
