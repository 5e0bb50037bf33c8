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

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;

import static java.util.Objects.requireNonNull;

/**
 * The unit of work handed to projection handlers by {@link SpringJdbcTransactionalSink}. Every statement executed through
 * {@link #jdbc()} takes part in the transaction of the event being processed.
 */
public class JdbcProjectionTransaction {
    private final JdbcTemplate jdbcTemplate;
    private final TransactionStatus transactionStatus;

    JdbcProjectionTransaction(JdbcTemplate jdbcTemplate, TransactionStatus transactionStatus) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionStatus, TransactionStatus.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = jdbcTemplate;
        this.transactionStatus = transactionStatus;
    }

    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * Execute an insert, update or delete statement in this transaction.
     *
     * @return The number of affected rows
     */
    public int update(String sql, Object... args) {
        return jdbcTemplate.update(sql, args);
    }

    /**
     * Roll back this transaction when the handler returns, instead of committing it. The checkpoint is not advanced either and
     * {@link SpringJdbcTransactionalSink} throws an {@link org.springframework.transaction.UnexpectedRollbackException}, which faults the subscription.
     */
    public void setRollbackOnly() {
        transactionStatus.setRollbackOnly();
    }

    public boolean isRollbackOnly() {
        return transactionStatus.isRollbackOnly();
    }
}
