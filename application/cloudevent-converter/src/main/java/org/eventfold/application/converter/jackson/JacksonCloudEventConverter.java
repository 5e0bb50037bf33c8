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

package org.eventfold.application.converter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.eventfold.application.converter.CloudEventConverter;
import org.eventfold.application.converter.DecodedEvent;
import org.eventfold.application.converter.EventTypeRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * An {@link CloudEventConverter} that uses a Jackson {@link ObjectMapper} to serialize a domain event to JSON (content type {@value #DEFAULT_CONTENT_TYPE}) that is used as data in a {@link CloudEvent}.
 * Cloud event types are resolved through an {@link EventTypeRegistry}, types missing from the registry decode to {@link DecodedEvent.Unrecognized}.
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonCloudEventConverter<T> implements CloudEventConverter<T> {
    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;
    private final URI cloudEventSource;
    private final EventTypeRegistry<T> eventTypeRegistry;
    private final Function<T, String> idMapper;
    private final Function<T, OffsetDateTime> timeMapper;
    private final Function<T, String> subjectMapper;
    private final String contentType;

    /**
     * Create a new instance of the {@link JacksonCloudEventConverter} that does the following:
     * <ol>
     *     <li>Uses a random UUID as cloud event id</li>
     *     <li>Uses the type registered in {@code eventTypeRegistry} as cloud event type</li>
     *     <li>Uses {@code OffsetDateTime.now(UTC)} as cloud event time</li>
     *     <li>No subject</li>
     * </ol>
     * Use {@link Builder} for more advanced configuration.
     *
     * @param objectMapper      The ObjectMapper instance to use
     * @param cloudEventSource  The cloud event source.
     * @param eventTypeRegistry The registry of known domain event types
     */
    public JacksonCloudEventConverter(ObjectMapper objectMapper, URI cloudEventSource, EventTypeRegistry<T> eventTypeRegistry) {
        this(objectMapper, cloudEventSource, eventTypeRegistry, defaultIdMapperFunction(), defaultTimeMapperFunction(), defaultSubjectMapperFunction(), DEFAULT_CONTENT_TYPE);
    }

    private JacksonCloudEventConverter(ObjectMapper objectMapper, URI cloudEventSource, EventTypeRegistry<T> eventTypeRegistry, Function<T, String> idMapper,
                                       Function<T, OffsetDateTime> timeMapper, Function<T, String> subjectMapper, String contentType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(eventTypeRegistry, EventTypeRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        requireNonNull(timeMapper, "timeMapper cannot be null");
        requireNonNull(subjectMapper, "subjectMapper cannot be null");
        requireNonNull(contentType, "contentType cannot be null");
        this.objectMapper = objectMapper;
        this.cloudEventSource = cloudEventSource;
        this.eventTypeRegistry = eventTypeRegistry;
        this.idMapper = idMapper;
        this.timeMapper = timeMapper;
        this.subjectMapper = subjectMapper;
        this.contentType = contentType;
    }

    @SuppressWarnings("unchecked")
    @Override
    public CloudEvent toCloudEvent(T domainEvent) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        // @formatter:off
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(objectMapper.convertValue(domainEvent, new TypeReference<Map<String, Object>>() {}), objectMapper::writeValueAsBytes);
        // @formatter:on
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(domainEvent))
                .withSource(cloudEventSource)
                .withType(eventTypeRegistry.typeOf((Class<? extends T>) domainEvent.getClass()))
                .withTime(timeMapper.apply(domainEvent))
                .withSubject(subjectMapper.apply(domainEvent))
                .withDataContentType(contentType)
                .withData(cloudEventData)
                .build();
    }

    /**
     * Converts the {@link CloudEvent} back into a domain event using {@link ObjectMapper}.
     *
     * @throws UncheckedIOException If the type is known but the data cannot be read as the registered class
     */
    @SuppressWarnings("unchecked")
    @Override
    public DecodedEvent<T> toDomainEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Optional<Class<? extends T>> domainEventType = eventTypeRegistry.classOf(cloudEvent.getType());
        if (domainEventType.isEmpty()) {
            return DecodedEvent.unrecognized(cloudEvent.getType());
        }

        CloudEventData data = cloudEvent.getData();
        final T domainEvent;
        if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            Map<String, Object> value = (Map<String, Object>) ((PojoCloudEventData<?>) data).getValue();
            domainEvent = objectMapper.convertValue(value, domainEventType.get());
        } else {
            try {
                domainEvent = objectMapper.readValue(requireNonNull(data, "cloud event data cannot be null").toBytes(), domainEventType.get());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return DecodedEvent.known(domainEvent);
    }

    @Override
    public String getCloudEventType(Class<? extends T> type) {
        return eventTypeRegistry.typeOf(type);
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final URI cloudEventSource;
        private final EventTypeRegistry<T> eventTypeRegistry;
        private String contentType = DEFAULT_CONTENT_TYPE;
        private Function<T, String> idMapper = defaultIdMapperFunction();
        private Function<T, OffsetDateTime> timeMapper = defaultTimeMapperFunction();
        private Function<T, String> subjectMapper = defaultSubjectMapperFunction();

        public Builder(ObjectMapper objectMapper, URI cloudEventSource, EventTypeRegistry<T> eventTypeRegistry) {
            this.objectMapper = objectMapper;
            this.cloudEventSource = cloudEventSource;
            this.eventTypeRegistry = eventTypeRegistry;
        }

        /**
         * @param contentType Specify the content type to use in the generated cloud event
         */
        public Builder<T> contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * @param idMapper A function that generates the cloud event id based on the domain event. By default, a random UUID is used.
         */
        public Builder<T> idMapper(Function<T, String> idMapper) {
            this.idMapper = idMapper;
            return this;
        }

        /**
         * @param timeMapper A function that generates the cloud event time based on the domain event. By default, {@code OffsetDateTime.now(UTC)} is always returned.
         */
        public Builder<T> timeMapper(Function<T, OffsetDateTime> timeMapper) {
            this.timeMapper = timeMapper;
            return this;
        }

        /**
         * @param subjectMapper A function that generates the cloud event subject based on the domain event. By default, {@code null} is always returned.
         */
        public Builder<T> subjectMapper(Function<T, String> subjectMapper) {
            this.subjectMapper = subjectMapper;
            return this;
        }

        public JacksonCloudEventConverter<T> build() {
            return new JacksonCloudEventConverter<>(objectMapper, cloudEventSource, eventTypeRegistry, idMapper, timeMapper, subjectMapper, contentType);
        }
    }

    private static <T> Function<T, String> defaultIdMapperFunction() {
        return __ -> UUID.randomUUID().toString();
    }

    private static <T> Function<T, OffsetDateTime> defaultTimeMapperFunction() {
        return __ -> OffsetDateTime.now(UTC);
    }

    private static <T> Function<T, String> defaultSubjectMapperFunction() {
        return __ -> null;
    }
}
