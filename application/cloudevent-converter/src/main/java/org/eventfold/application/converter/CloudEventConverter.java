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

package org.eventfold.application.converter;

import io.cloudevents.CloudEvent;

/**
 * A cloud event converter interface that is used by the command handler and the stream aggregator
 * to convert to and from domain events.
 *
 * @param <T> The type of your domain event
 */
public interface CloudEventConverter<T> {

    /**
     * Convert a domain event into a cloud event
     *
     * @param domainEvent The domain event to convert
     * @return A {@link CloudEvent} converted from the <code>domainEvent</code>.
     */
    CloudEvent toCloudEvent(T domainEvent);

    /**
     * Convert a cloud event back into a domain event. Cloud event types that this converter doesn't know about
     * are returned as {@link DecodedEvent.Unrecognized} instead of failing.
     *
     * @param cloudEvent The cloud event to convert
     * @return The decoded event
     */
    DecodedEvent<T> toDomainEvent(CloudEvent cloudEvent);

    /**
     * Get the cloud event type from a Java class.
     *
     * @param type The java class that represents a specific domain event type
     * @return The cloud event type of the domain event (cannot be {@code null})
     */
    String getCloudEventType(Class<? extends T> type);
}
