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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventfold.application.converter.EventTypeRegistry;
import org.eventfold.application.converter.jackson.JacksonCloudEventConverter;

import java.net.URI;
import java.util.List;

/**
 * A tiny domain used by the command handling tests.
 */
class NameDomain {

    sealed interface NameEvent permits NameDefined, NameWasChanged {
    }

    record NameDefined(String name) implements NameEvent {
    }

    record NameWasChanged(String name) implements NameEvent {
    }

    record Person(String name, int changes) {
    }

    record DefineName(String name) {
    }

    record ChangeName(String name) {
    }

    static final EventTypeRegistry<NameEvent> REGISTRY = EventTypeRegistry.<NameEvent>builder()
            .register(NameDefined.class)
            .register(NameWasChanged.class)
            .build();

    static JacksonCloudEventConverter<NameEvent> converter() {
        return new JacksonCloudEventConverter<>(new ObjectMapper(), URI.create("urn:eventfold:test:name"), REGISTRY);
    }

    static Person evolve(Person state, NameEvent event) {
        if (event instanceof NameDefined defined) {
            return new Person(defined.name(), 0);
        } else if (event instanceof NameWasChanged changed) {
            return new Person(changed.name(), state.changes() + 1);
        }
        throw new IllegalArgumentException("Unknown event " + event);
    }

    static List<NameEvent> defineName(DefineName command) {
        return List.of(new NameDefined(command.name()));
    }

    static List<NameEvent> changeName(Person person, ChangeName command) {
        if (person.name().equals(command.name())) {
            throw new DomainException("NAME_UNCHANGED", "Name is already " + command.name());
        }
        return List.of(new NameWasChanged(command.name()));
    }
}
