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

import static java.util.Objects.requireNonNull;

/**
 * The result of converting a {@link io.cloudevents.CloudEvent} into a domain event. Either the type was
 * {@link Known known} and the payload has been decoded, or it was {@link Unrecognized unrecognized},
 * typically because the event was written by a newer version of the application.
 *
 * @param <T> The type of your domain event
 */
public sealed interface DecodedEvent<T> {

    static <T> DecodedEvent<T> known(T event) {
        return new Known<>(event);
    }

    static <T> DecodedEvent<T> unrecognized(String type) {
        return new Unrecognized<>(type);
    }

    record Known<T>(T event) implements DecodedEvent<T> {
        public Known {
            requireNonNull(event, "Event cannot be null");
        }
    }

    record Unrecognized<T>(String type) implements DecodedEvent<T> {
        public Unrecognized {
            requireNonNull(type, "Type cannot be null");
        }
    }
}
