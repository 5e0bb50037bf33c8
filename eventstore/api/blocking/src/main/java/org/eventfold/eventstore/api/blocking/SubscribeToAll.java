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

import org.eventfold.subscription.SubscriptionPosition;

/**
 * Event stores that can be read as one store-wide, totally ordered log should implement this interface.
 */
public interface SubscribeToAll {

    /**
     * Open a cursor over the global log.
     *
     * @param position Where to start, the cursor delivers the event at {@link SubscriptionPosition#nextGlobalPosition()} first.
     * @return An open {@link AllStreamSubscription}. Close it when done.
     * @throws org.eventfold.eventstore.api.EventStoreUnavailableException If the event store cannot be reached
     */
    AllStreamSubscription subscribeToAll(SubscriptionPosition position);
}
