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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class EventTypeRegistryTest {

    interface Event {
    }

    static class Opened implements Event {
    }

    static class Closed implements Event {
    }

    @Test
    void resolves_types_in_both_directions() {
        EventTypeRegistry<Event> registry = EventTypeRegistry.<Event>builder()
                .register(Opened.class)
                .register("closed.v1", Closed.class)
                .build();

        assertThat(registry.typeOf(Opened.class)).isEqualTo("Opened");
        assertThat(registry.typeOf(Closed.class)).isEqualTo("closed.v1");
        assertThat(registry.classOf("closed.v1")).contains(Closed.class);
        assertThat(registry.classOf("Closed")).isEmpty();
        assertThat(registry.types()).containsExactly("Opened", "closed.v1");
    }

    @Test
    void the_same_type_cannot_be_registered_twice() {
        EventTypeRegistry.Builder<Event> builder = EventTypeRegistry.<Event>builder().register("event", Opened.class);

        Throwable throwable = catchThrowable(() -> builder.register("event", Closed.class));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void the_same_class_cannot_be_registered_under_two_types() {
        EventTypeRegistry.Builder<Event> builder = EventTypeRegistry.<Event>builder().register("opened", Opened.class);

        Throwable throwable = catchThrowable(() -> builder.register("opened.v2", Opened.class));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
