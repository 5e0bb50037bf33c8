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

package org.eventfold.example.projection.cartdetails;

import org.eventfold.eventstore.api.blocking.SubscribeToAll;
import org.eventfold.example.domain.shoppingcart.application.ShoppingCartCloudEventConverter;
import org.eventfold.subscription.api.blocking.ProjectionHandler;
import org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscription;
import org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscriptionConfig;
import org.eventfold.subscription.jdbc.spring.JdbcProjectionTransaction;
import org.eventfold.subscription.jdbc.spring.SpringJdbcCheckpointStore;
import org.eventfold.subscription.jdbc.spring.SpringJdbcTransactionalSink;

import javax.sql.DataSource;
import java.util.List;

import static org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscriptionConfig.checkpointedSubscriptionConfig;

/**
 * Wires a {@link CheckpointedSubscription} that keeps the cart details read model up to date. The checkpoint is stored in the
 * same database as the read model.
 */
public final class CartDetailsSubscription {
    public static final String SUBSCRIPTION_NAME = "cart-details";

    private CartDetailsSubscription() {
    }

    public static CheckpointedSubscription<JdbcProjectionTransaction> create(SubscribeToAll eventStore, DataSource dataSource) {
        return create(eventStore, dataSource, checkpointedSubscriptionConfig());
    }

    public static CheckpointedSubscription<JdbcProjectionTransaction> create(SubscribeToAll eventStore, DataSource dataSource, CheckpointedSubscriptionConfig config) {
        SpringJdbcTransactionalSink sink = new SpringJdbcTransactionalSink(dataSource);
        SpringJdbcCheckpointStore checkpointStore = new SpringJdbcCheckpointStore(sink.jdbcTemplate());
        ProjectionHandler<JdbcProjectionTransaction> projection = new CartDetailsProjection(ShoppingCartCloudEventConverter.create());
        return new CheckpointedSubscription<>(SUBSCRIPTION_NAME, eventStore, sink, checkpointStore, List.of(projection), config);
    }
}
