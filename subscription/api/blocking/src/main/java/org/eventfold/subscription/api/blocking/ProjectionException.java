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
 * Thrown (and reported to the failure listener) when a {@link ProjectionHandler} fails to apply an event.
 * The transaction has been rolled back, so neither the projection nor the checkpoint reflect the event.
 */
public class ProjectionException extends RuntimeException {
    private final String subscriptionName;
    private final long globalPosition;
    private final String eventType;

    public ProjectionException(String subscriptionName, long globalPosition, String eventType, Throwable cause) {
        super(String.format("Subscription \"%s\" failed to apply event of type %s at global position %d", subscriptionName, eventType, globalPosition), cause);
        this.subscriptionName = subscriptionName;
        this.globalPosition = globalPosition;
        this.eventType = eventType;
    }

    public String getSubscriptionName() {
        return subscriptionName;
    }

    public long getGlobalPosition() {
        return globalPosition;
    }

    public String getEventType() {
        return eventType;
    }
}
