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

import org.eventfold.application.command.NameDomain.ChangeName;
import org.eventfold.application.command.NameDomain.DefineName;
import org.eventfold.application.command.NameDomain.NameEvent;
import org.eventfold.application.command.NameDomain.Person;
import org.eventfold.application.converter.DecodedEvent;
import org.eventfold.application.converter.jackson.JacksonCloudEventConverter;
import org.eventfold.eventstore.api.ConcurrencyConflictException;
import org.eventfold.eventstore.api.WriteResult;
import org.eventfold.eventstore.inmemory.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventfold.eventstore.api.ExpectedRevision.exactly;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class GenericCommandHandlerTest {

    private InMemoryEventStore eventStore;
    private JacksonCloudEventConverter<NameEvent> converter;
    private GenericCommandHandler<Person, NameEvent> commandHandler;

    @BeforeEach
    void create_command_handler() {
        eventStore = new InMemoryEventStore();
        converter = NameDomain.converter();
        commandHandler = new GenericCommandHandler<>(eventStore, converter, NameDomain::evolve);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void writes_the_events_returned_by_the_decision_function_to_a_new_stream() {
            // When
            WriteResult writeResult = commandHandler.create("name", new DefineName("John"), NameDomain::defineName);

            // Then
            assertAll(
                    () -> assertThat(writeResult.getNextExpectedRevision()).isEqualTo(0L),
                    () -> assertThat(domainEvents("name")).containsExactly(new NameDomain.NameDefined("John"))
            );
        }

        @Test
        void fails_with_concurrency_conflict_when_the_stream_already_exists() {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.create("name", new DefineName("Jane"), NameDomain::defineName));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(domainEvents("name")).containsExactly(new NameDomain.NameDefined("John"))
            );
        }

        @Test
        void curried_form_is_bound_to_the_decision_function() {
            // Given
            CreateCommand<DefineName> defineName = commandHandler.create(NameDomain::defineName);

            // When
            WriteResult writeResult = defineName.execute("name", new DefineName("John"));

            // Then
            assertThat(writeResult.getNextExpectedRevision()).isEqualTo(0L);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void create_followed_by_update_with_the_returned_revision_succeeds_and_a_stale_update_fails() {
            // Given
            WriteResult created = commandHandler.create("name", new DefineName("John"), NameDomain::defineName);

            // When
            WriteResult updated = commandHandler.update("name", new ChangeName("Jan"), exactly(created.getNextExpectedRevision()), NameDomain::changeName);
            Throwable stale = catchThrowable(() -> commandHandler.update("name", new ChangeName("Jack"), exactly(created.getNextExpectedRevision()), NameDomain::changeName));

            // Then
            assertAll(
                    () -> assertThat(created.getNextExpectedRevision()).isEqualTo(0L),
                    () -> assertThat(updated.getNextExpectedRevision()).isEqualTo(1L),
                    () -> assertThat(stale).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(((ConcurrencyConflictException) stale).actualRevision).isEqualTo(1L),
                    () -> assertThat(eventStore.read("name").revision()).isEqualTo(1L)
            );
        }

        @Test
        void decision_function_receives_the_folded_state() {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);
            commandHandler.update("name", new ChangeName("Jan"), NameDomain::changeName);
            List<Person> seen = new ArrayList<>();

            // When
            commandHandler.update("name", new ChangeName("Jack"), (person, command) -> {
                seen.add(person);
                return NameDomain.changeName(person, command);
            });

            // Then
            assertThat(seen).containsExactly(new Person("Jan", 1));
        }

        @Test
        void no_expected_revision_means_any_revision() {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);
            commandHandler.update("name", new ChangeName("Jan"), NameDomain::changeName);

            // When
            WriteResult writeResult = commandHandler.update("name", new ChangeName("Jack"), null, NameDomain::changeName);

            // Then
            assertThat(writeResult.getNextExpectedRevision()).isEqualTo(2L);
        }

        @Test
        void fails_with_stream_not_found_when_the_stream_has_no_events() {
            // When
            Throwable throwable = catchThrowable(() -> commandHandler.update("name", new ChangeName("Jan"), NameDomain::changeName));

            // Then
            assertThat(throwable).isExactlyInstanceOf(StreamNotFoundException.class);
            assertThat(((StreamNotFoundException) throwable).getStreamId()).isEqualTo("name");
        }

        @Test
        void domain_exceptions_propagate_and_are_not_retried() {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);
            AtomicInteger invocations = new AtomicInteger();

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.update("name", new ChangeName("John"), (person, command) -> {
                invocations.incrementAndGet();
                return NameDomain.changeName(person, command);
            }));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(DomainException.class),
                    () -> assertThat(((DomainException) throwable).getErrorCode()).isEqualTo("NAME_UNCHANGED"),
                    () -> assertThat(invocations).hasValue(1),
                    () -> assertThat(eventStore.read("name").revision()).isEqualTo(0L)
            );
        }

        @Test
        void decision_returning_no_events_leaves_the_stream_unchanged() {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);

            // When
            WriteResult writeResult = commandHandler.update("name", new ChangeName("Jan"), exactly(0), (person, command) -> List.of());

            // Then
            assertAll(
                    () -> assertThat(writeResult.streamChanged()).isFalse(),
                    () -> assertThat(writeResult.getNextExpectedRevision()).isEqualTo(0L)
            );
        }

        @Test
        void curried_form_passes_the_expected_revision_through() {
            // Given
            UpdateCommand<ChangeName> changeName = commandHandler.update(NameDomain::changeName);
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);

            // When
            WriteResult writeResult = changeName.execute("name", new ChangeName("Jan"), exactly(0));
            Throwable stale = catchThrowable(() -> changeName.execute("name", new ChangeName("Jack"), exactly(0)));

            // Then
            assertAll(
                    () -> assertThat(writeResult.getNextExpectedRevision()).isEqualTo(1L),
                    () -> assertThat(stale).isExactlyInstanceOf(ConcurrencyConflictException.class)
            );
        }

        @Test
        void exactly_one_of_two_concurrent_updates_with_the_same_expected_revision_succeeds() throws Exception {
            // Given
            commandHandler.create("name", new DefineName("John"), NameDomain::defineName);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch bothHaveRead = new CountDownLatch(2);
            AtomicInteger conflicts = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            // When
            for (String name : List.of("Jan", "Jack")) {
                futures.add(executor.submit(() -> {
                    try {
                        commandHandler.update("name", new ChangeName(name), exactly(0), (person, command) -> {
                            // Both decisions are made on revision 0 before either of them writes
                            bothHaveRead.countDown();
                            awaitUninterruptibly(bothHaveRead);
                            return NameDomain.changeName(person, command);
                        });
                    } catch (ConcurrencyConflictException e) {
                        conflicts.incrementAndGet();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Then
            assertAll(
                    () -> assertThat(conflicts).hasValue(1),
                    () -> assertThat(eventStore.read("name").revision()).isEqualTo(1L)
            );
        }
    }

    private List<NameEvent> domainEvents(String streamId) {
        return eventStore.read(streamId).events()
                .map(converter::toDomainEvent)
                .map(decoded -> ((DecodedEvent.Known<NameEvent>) decoded).event())
                .collect(Collectors.toList());
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Timed out waiting for latch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
