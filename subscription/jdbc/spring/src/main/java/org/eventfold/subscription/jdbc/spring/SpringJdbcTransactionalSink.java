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

import org.eventfold.subscription.api.blocking.TransactionalSink;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.UnexpectedRollbackException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TransactionalSink} backed by a relational database accessed through Spring JDBC. Each call to {@link #inTransaction(Consumer)}
 * runs in a new transaction of the supplied {@link PlatformTransactionManager}, which must manage the {@link DataSource} of the {@link JdbcTemplate}.
 * Work that marks the transaction as rollback-only gets it rolled back and an {@link UnexpectedRollbackException} thrown,
 * the same as work that throws.
 */
public class SpringJdbcTransactionalSink implements TransactionalSink<JdbcProjectionTransaction> {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SpringJdbcTransactionalSink(DataSource dataSource) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")), new DataSourceTransactionManager(dataSource));
    }

    public SpringJdbcTransactionalSink(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void inTransaction(Consumer<JdbcProjectionTransaction> work) {
        requireNonNull(work, "Work cannot be null");
        transactionTemplate.executeWithoutResult(status -> {
            work.accept(new JdbcProjectionTransaction(jdbcTemplate, status));
            if (status.isRollbackOnly()) {
                throw new UnexpectedRollbackException("Transaction was marked as rollback-only and has been rolled back");
            }
        });
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }
}
