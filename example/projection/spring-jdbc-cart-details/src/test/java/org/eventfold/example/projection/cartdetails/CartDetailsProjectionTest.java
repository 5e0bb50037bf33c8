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

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.eventfold.application.command.GenericCommandHandler;
import org.eventfold.eventstore.inmemory.InMemoryEventStore;
import org.eventfold.example.domain.shoppingcart.application.ShoppingCartCloudEventConverter;
import org.eventfold.example.domain.shoppingcart.application.ShoppingCartService;
import org.eventfold.example.domain.shoppingcart.commands.AddProductItemToShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.ConfirmShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.OpenShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.RemoveProductItemFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.model.AdditionalInfo;
import org.eventfold.example.domain.shoppingcart.model.PricedProductItem;
import org.eventfold.example.domain.shoppingcart.model.ProductItem;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCart;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCartDecisions;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCartStatus;
import org.eventfold.example.domain.shoppingcart.model.User;
import org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscription;
import org.eventfold.subscription.jdbc.spring.JdbcProjectionTransaction;
import org.eventfold.subscription.jdbc.spring.SpringJdbcCheckpointStore;
import org.eventfold.subscription.jdbc.spring.SpringJdbcTransactionalSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;
import static org.eventfold.eventstore.api.ExpectedRevision.any;
import static org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscriptionConfig.checkpointedSubscriptionConfig;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class CartDetailsProjectionTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final User JANE = new User(7, "Jane", "Doe", "jane@example.com");

    private EmbeddedDatabase database;
    private InMemoryEventStore eventStore;
    private ShoppingCartService shoppingCartService;
    private CartDetailsQueries queries;
    private SpringJdbcCheckpointStore checkpointStore;
    private CheckpointedSubscription<JdbcProjectionTransaction> subscription;

    @BeforeEach
    void create_database_and_shopping_cart_service() {
        database = new EmbeddedDatabaseBuilder().generateUniqueName(true).setType(EmbeddedDatabaseType.H2).addScript("schema.sql").build();
        SpringJdbcTransactionalSink sink = new SpringJdbcTransactionalSink(database);
        queries = new CartDetailsQueries(sink.jdbcTemplate());
        checkpointStore = new SpringJdbcCheckpointStore(sink.jdbcTemplate());
        eventStore = new InMemoryEventStore();
        ShoppingCartDecisions decisions = new ShoppingCartDecisions(
                item -> new PricedProductItem(item.productId(), "SKU-" + item.productId(), item.quantity(), new BigDecimal("9.95"), new BigDecimal("0.50")),
                userId -> userId == JANE.id() ? Optional.of(JANE) : Optional.empty(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        shoppingCartService = new ShoppingCartService(
                new GenericCommandHandler<ShoppingCart, ShoppingCartEvent>(eventStore, ShoppingCartCloudEventConverter.create(), ShoppingCart::evolve), decisions);
        subscription = CartDetailsSubscription.create(eventStore, database, checkpointedSubscriptionConfig().pollTimeout(Duration.ofMillis(50)));
    }

    @AfterEach
    void shutdown() {
        subscription.stop();
        database.shutdown();
    }

    @Test
    void projects_an_opened_cart() {
        // Given
        shoppingCartService.open(new OpenShoppingCart("1"));

        // When
        subscription.start();

        // Then
        awaitCheckpoint(1);
        CartDetails cart = queries.findByCartId("1").orElseThrow();
        assertAll(
                () -> assertThat(cart.status()).isEqualTo(ShoppingCartStatus.OPENED),
                () -> assertThat(cart.revision()).isZero(),
                () -> assertThat(cart.createdAt()).isEqualTo(NOW),
                () -> assertThat(cart.customer()).isNull(),
                () -> assertThat(cart.items()).isEmpty()
        );
    }

    @Test
    void merges_quantities_of_the_same_product_and_removes_empty_items() {
        // Given
        subscription.start();

        // When
        shoppingCartService.open(new OpenShoppingCart("1"));
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(10, 2)), null);
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(11, 1)), null);
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(10, 3)), null);
        shoppingCartService.removeProductItem(new RemoveProductItemFromShoppingCart("1", new ProductItem(11, 1)), null);

        // Then
        awaitCheckpoint(5);
        CartDetails cart = queries.findByCartId("1").orElseThrow();
        assertAll(
                () -> assertThat(cart.revision()).isEqualTo(4L),
                () -> assertThat(cart.items()).extracting(CartDetails.Item::productId, CartDetails.Item::quantity).containsExactly(tuple(10L, 5)),
                () -> assertThat(cart.items().get(0).price()).isEqualByComparingTo("9.95"),
                () -> assertThat(cart.items().get(0).discount()).isEqualByComparingTo("0.50")
        );
    }

    @Test
    void projects_the_customer_of_a_confirmed_cart() {
        // Given
        shoppingCartService.open(new OpenShoppingCart("1"));
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(10, 2)), null);
        shoppingCartService.confirm(new ConfirmShoppingCart("1", JANE.id(), new AdditionalInfo("Leave at the door", "Main street 1", null)), null);

        // When
        subscription.start();

        // Then
        awaitCheckpoint(3);
        CartDetails cart = queries.findByCartId("1").orElseThrow();
        assertAll(
                () -> assertThat(cart.status()).isEqualTo(ShoppingCartStatus.CONFIRMED),
                () -> assertThat(cart.customer()).isEqualTo(new CartDetails.Customer(7, "Jane", "Doe", "jane@example.com")),
                () -> assertThat(cart.additionalInfo()).isEqualTo("Leave at the door"),
                () -> assertThat(cart.addressLine1()).isEqualTo("Main street 1"),
                () -> assertThat(cart.addressLine2()).isNull(),
                () -> assertThat(cart.updatedAt()).isEqualTo(NOW)
        );
    }

    @Test
    void replaying_all_events_leaves_the_read_model_unchanged() {
        // Given
        shoppingCartService.open(new OpenShoppingCart("1"));
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(10, 2)), null);
        shoppingCartService.removeProductItem(new RemoveProductItemFromShoppingCart("1", new ProductItem(10, 1)), null);
        subscription.start();
        awaitCheckpoint(3);
        CartDetails projected = queries.findByCartId("1").orElseThrow();
        subscription.stop();

        // When
        checkpointStore.delete(CartDetailsSubscription.SUBSCRIPTION_NAME);
        subscription.start();

        // Then
        awaitCheckpoint(3);
        assertThat(queries.findByCartId("1")).contains(projected);
    }

    @Test
    void events_that_are_not_shopping_cart_events_are_ignored() {
        // Given
        eventStore.write("something-else", any(), Stream.of(CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(URI.create("urn:eventfold:test"))
                .withType("SomethingHappened")
                .withData("{}".getBytes(UTF_8))
                .build()));
        shoppingCartService.open(new OpenShoppingCart("1"));

        // When
        subscription.start();

        // Then
        awaitCheckpoint(2);
        assertThat(queries.findByCartId("1")).isPresent();
        assertThat(queries.findByCartId("something-else")).isEmpty();
    }

    @Test
    void delivering_the_same_event_twice_applies_it_once() {
        // Given
        shoppingCartService.open(new OpenShoppingCart("1"));
        shoppingCartService.addProductItem(new AddProductItemToShoppingCart("1", new ProductItem(10, 2)), null);
        List<CloudEvent> cloudEvents = eventStore.read(ShoppingCartService.streamName("1")).eventList();
        SpringJdbcTransactionalSink sink = new SpringJdbcTransactionalSink(database);
        CartDetailsProjection projection = new CartDetailsProjection(ShoppingCartCloudEventConverter.create());

        // When
        for (int i = 0; i < 2; i++) {
            cloudEvents.forEach(cloudEvent -> sink.inTransaction(transaction -> projection.handle(transaction, cloudEvent)));
        }

        // Then
        CartDetails cart = queries.findByCartId("1").orElseThrow();
        assertThat(cart.revision()).isEqualTo(1L);
        assertThat(cart.items()).extracting(CartDetails.Item::productId, CartDetails.Item::quantity).containsExactly(tuple(10L, 2));
    }

    private void awaitCheckpoint(long nextGlobalPosition) {
        await().atMost(Duration.ofSeconds(5)).until(() -> checkpointStore.load(CartDetailsSubscription.SUBSCRIPTION_NAME).nextGlobalPosition(), equalTo(nextGlobalPosition));
    }
}
