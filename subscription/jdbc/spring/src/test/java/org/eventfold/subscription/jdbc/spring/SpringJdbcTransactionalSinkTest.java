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

package org.eventfold.subscription.jdbc.spring;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.UnexpectedRollbackException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class SpringJdbcTransactionalSinkTest {

    private EmbeddedDatabase database;
    private SpringJdbcTransactionalSink sink;

    @BeforeEach
    void create_database() {
        database = new EmbeddedDatabaseBuilder().generateUniqueName(true).setType(EmbeddedDatabaseType.H2).addScript("schema.sql").build();
        sink = new SpringJdbcTransactionalSink(database);
    }

    @AfterEach
    void shutdown_database() {
        database.shutdown();
    }

    @Test
    void commits_when_the_work_returns_normally() {
        // When
        sink.inTransaction(tx -> {
            tx.update("INSERT INTO counters (counter_id, revision, total) VALUES (?, ?, ?)", "a", 0, 1);
            tx.update("INSERT INTO counters (counter_id, revision, total) VALUES (?, ?, ?)", "b", 0, 2);
        });

        // Then
        assertThat(countRows()).isEqualTo(2);
    }

    @Test
    void rolls_back_every_statement_and_rethrows_when_the_work_throws() {
        // When
        Throwable throwable = catchThrowable(() -> sink.inTransaction(tx -> {
            tx.update("INSERT INTO counters (counter_id, revision, total) VALUES (?, ?, ?)", "a", 0, 1);
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected");
        assertThat(countRows()).isZero();
    }

    @Test
    void rolls_back_and_throws_when_the_work_marks_the_transaction_rollback_only() {
        // When
        Throwable throwable = catchThrowable(() -> sink.inTransaction(tx -> {
            tx.update("INSERT INTO counters (counter_id, revision, total) VALUES (?, ?, ?)", "a", 0, 1);
            tx.setRollbackOnly();
        }));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UnexpectedRollbackException.class);
        assertThat(countRows()).isZero();
    }

    private Integer countRows() {
        return sink.jdbcTemplate().queryForObject("SELECT COUNT(*) FROM counters", Integer.class);
    }
}
