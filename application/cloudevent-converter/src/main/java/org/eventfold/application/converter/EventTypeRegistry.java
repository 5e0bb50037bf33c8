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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A closed mapping between cloud event types and the Java classes of the domain events they represent.
 * A type name maps to exactly one class and a class to exactly one type name.
 *
 * @param <T> The base type of your domain events
 */
public class EventTypeRegistry<T> {
    private final Map<String, Class<? extends T>> classesByType;
    private final Map<Class<? extends T>, String> typesByClass;

    private EventTypeRegistry(Map<String, Class<? extends T>> classesByType, Map<Class<? extends T>, String> typesByClass) {
        this.classesByType = Collections.unmodifiableMap(classesByType);
        this.typesByClass = Collections.unmodifiableMap(typesByClass);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * @param type The cloud event type
     * @return The class registered for {@code type}, or empty if the type is unknown
     */
    public Optional<Class<? extends T>> classOf(String type) {
        return Optional.ofNullable(classesByType.get(type));
    }

    /**
     * @param domainEventClass The class of a domain event
     * @return The cloud event type registered for the class
     * @throws IllegalArgumentException If the class has not been registered
     */
    public String typeOf(Class<? extends T> domainEventClass) {
        String type = typesByClass.get(domainEventClass);
        if (type == null) {
            throw new IllegalArgumentException("No cloud event type registered for " + domainEventClass.getName());
        }
        return type;
    }

    public Set<String> types() {
        return classesByType.keySet();
    }

    public static final class Builder<T> {
        private final Map<String, Class<? extends T>> classesByType = new LinkedHashMap<>();
        private final Map<Class<? extends T>, String> typesByClass = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a domain event class under its {@link Class#getSimpleName() simple name}.
         */
        public Builder<T> register(Class<? extends T> domainEventClass) {
            requireNonNull(domainEventClass, "Domain event class cannot be null");
            return register(domainEventClass.getSimpleName(), domainEventClass);
        }

        public Builder<T> register(String type, Class<? extends T> domainEventClass) {
            requireNonNull(type, "Type cannot be null");
            requireNonNull(domainEventClass, "Domain event class cannot be null");
            if (classesByType.containsKey(type)) {
                throw new IllegalArgumentException("Cloud event type " + type + " is already registered to " + classesByType.get(type).getName());
            } else if (typesByClass.containsKey(domainEventClass)) {
                throw new IllegalArgumentException(domainEventClass.getName() + " is already registered as " + typesByClass.get(domainEventClass));
            }
            classesByType.put(type, domainEventClass);
            typesByClass.put(domainEventClass, type);
            return this;
        }

        public EventTypeRegistry<T> build() {
            return new EventTypeRegistry<>(new LinkedHashMap<>(classesByType), new LinkedHashMap<>(typesByClass));
        }
    }
}
