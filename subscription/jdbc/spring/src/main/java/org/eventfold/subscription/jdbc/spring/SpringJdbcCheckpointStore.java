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

import org.eventfold.subscription.SubscriptionPosition;
import org.eventfold.subscription.api.blocking.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CheckpointStore} that stores checkpoints in a relational table with the columns {@code subscription_name} (primary key)
 * and {@code position}, for example:
 * <pre>
 * CREATE TABLE subscription_checkpoints (
 *     subscription_name VARCHAR(255) PRIMARY KEY,
 *     position          BIGINT       NOT NULL
 * );
 * </pre>
 * Checkpoints are saved with the {@link JdbcProjectionTransaction} of the event being processed.
 */
public class SpringJdbcCheckpointStore implements CheckpointStore<JdbcProjectionTransaction> {
    private static final Logger log = LoggerFactory.getLogger(SpringJdbcCheckpointStore.class);

    public static final String DEFAULT_TABLE_NAME = "subscription_checkpoints";
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbcTemplate;
    private final String selectPosition;
    private final String advancePosition;
    private final String countCheckpoints;
    private final String insertCheckpoint;
    private final String deleteCheckpoint;

    public SpringJdbcCheckpointStore(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, DEFAULT_TABLE_NAME);
    }

    public SpringJdbcCheckpointStore(JdbcTemplate jdbcTemplate, String tableName) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(tableName, "Table name cannot be null");
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.selectPosition = "SELECT position FROM " + tableName + " WHERE subscription_name = ?";
        this.advancePosition = "UPDATE " + tableName + " SET position = ? WHERE subscription_name = ? AND position < ?";
        this.countCheckpoints = "SELECT COUNT(*) FROM " + tableName + " WHERE subscription_name = ?";
        this.insertCheckpoint = "INSERT INTO " + tableName + " (subscription_name, position) VALUES (?, ?)";
        this.deleteCheckpoint = "DELETE FROM " + tableName + " WHERE subscription_name = ?";
    }

    @Override
    public SubscriptionPosition load(String subscriptionName) {
        requireNonNull(subscriptionName, "Subscription name cannot be null");
        List<Long> positions = jdbcTemplate.queryForList(selectPosition, Long.class, subscriptionName);
        if (positions.isEmpty()) {
            return SubscriptionPosition.beginning();
        }
        return SubscriptionPosition.after(positions.get(0));
    }

    @Override
    public void save(JdbcProjectionTransaction transaction, String subscriptionName, long globalPosition) {
        requireNonNull(transaction, JdbcProjectionTransaction.class.getSimpleName() + " cannot be null");
        requireNonNull(subscriptionName, "Subscription name cannot be null");
        if (globalPosition < 0) {
            throw new IllegalArgumentException("Global position cannot be negative");
        }
        JdbcTemplate jdbc = transaction.jdbc();
        if (jdbc.update(advancePosition, globalPosition, subscriptionName, globalPosition) == 1) {
            return;
        }
        Integer existing = jdbc.queryForObject(countCheckpoints, Integer.class, subscriptionName);
        if (existing != null && existing > 0) {
            log.debug("Checkpoint of subscription {} is already at or after {}", subscriptionName, globalPosition);
            return;
        }
        jdbc.update(insertCheckpoint, subscriptionName, globalPosition);
    }

    @Override
    public void delete(String subscriptionName) {
        requireNonNull(subscriptionName, "Subscription name cannot be null");
        jdbcTemplate.update(deleteCheckpoint, subscriptionName);
        log.info("Deleted checkpoint of subscription {}", subscriptionName);
    }

    @Override
    public boolean exists(String subscriptionName) {
        requireNonNull(subscriptionName, "Subscription name cannot be null");
        Integer count = jdbcTemplate.queryForObject(countCheckpoints, Integer.class, subscriptionName);
        return count != null && count > 0;
    }
}
