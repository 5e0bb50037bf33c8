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
import org.eventfold.application.converter.CloudEventConverter;
import org.eventfold.application.converter.DecodedEvent;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemAddedToShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemRemovedFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartConfirmed;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartOpened;
import org.eventfold.example.domain.shoppingcart.model.AdditionalInfo;
import org.eventfold.example.domain.shoppingcart.model.PricedProductItem;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCartStatus;
import org.eventfold.example.domain.shoppingcart.model.User;
import org.eventfold.subscription.api.blocking.ProjectionHandler;
import org.eventfold.subscription.jdbc.spring.JdbcProjectionTransaction;
import org.eventfold.subscription.jdbc.spring.RevisionFence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.Instant;

import static java.util.Objects.requireNonNull;
import static org.eventfold.cloudevents.EventfoldExtensionGetter.getStreamRevision;

/**
 * Projects shopping cart events into the {@code carts} and {@code cart_items} tables.
 * <p>
 * The {@code carts} row keeps the stream revision of the last applied event. Opening a cart inserts the row unless it already exists,
 * every later event first advances the row through a {@link RevisionFence} and is skipped if the fence doesn't move. Redelivering an
 * event therefore leaves the read model unchanged. Events that are not shopping cart events are ignored.
 */
public class CartDetailsProjection implements ProjectionHandler<JdbcProjectionTransaction> {
    private static final Logger log = LoggerFactory.getLogger(CartDetailsProjection.class);

    private final CloudEventConverter<ShoppingCartEvent> cloudEventConverter;
    private final RevisionFence revisionFence = new RevisionFence("carts", "cart_id");

    public CartDetailsProjection(CloudEventConverter<ShoppingCartEvent> cloudEventConverter) {
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        this.cloudEventConverter = cloudEventConverter;
    }

    @Override
    public void handle(JdbcProjectionTransaction transaction, CloudEvent cloudEvent) {
        DecodedEvent<ShoppingCartEvent> decoded = cloudEventConverter.toDomainEvent(cloudEvent);
        if (!(decoded instanceof DecodedEvent.Known<ShoppingCartEvent> known)) {
            return;
        }
        ShoppingCartEvent event = known.event();
        long revision = getStreamRevision(cloudEvent);
        if (event instanceof ShoppingCartOpened opened) {
            cartOpened(transaction, opened, revision);
        } else if (!revisionFence.tryAdvance(transaction, event.cartId(), revision)) {
            return;
        } else if (event instanceof ProductItemAddedToShoppingCart added) {
            productItemAdded(transaction, added);
        } else if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            productItemRemoved(transaction, removed);
        } else if (event instanceof ShoppingCartConfirmed confirmed) {
            cartConfirmed(transaction, confirmed);
        }
    }

    private static void cartOpened(JdbcProjectionTransaction transaction, ShoppingCartOpened opened, long revision) {
        Integer existing = transaction.jdbc().queryForObject("SELECT COUNT(*) FROM carts WHERE cart_id = ?", Integer.class, opened.cartId());
        if (existing != null && existing > 0) {
            log.debug("Cart {} is already projected", opened.cartId());
            return;
        }
        transaction.update("INSERT INTO carts (cart_id, revision, status, created_at) VALUES (?, ?, ?, ?)",
                opened.cartId(), revision, ShoppingCartStatus.OPENED.name(), timestamp(opened.openedAt()));
    }

    private static void productItemAdded(JdbcProjectionTransaction transaction, ProductItemAddedToShoppingCart added) {
        PricedProductItem item = added.productItem();
        Timestamp addedAt = timestamp(added.addedAt());
        touch(transaction, added.cartId(), addedAt);
        int updated = transaction.update("UPDATE cart_items SET quantity = quantity + ?, updated_at = ? WHERE cart_id = ? AND product_id = ?",
                item.quantity(), addedAt, added.cartId(), item.productId());
        if (updated == 0) {
            transaction.update("INSERT INTO cart_items (cart_id, product_id, sku, price, discount, quantity, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    added.cartId(), item.productId(), item.sku(), item.price(), item.discount(), item.quantity(), addedAt);
        }
    }

    private static void productItemRemoved(JdbcProjectionTransaction transaction, ProductItemRemovedFromShoppingCart removed) {
        PricedProductItem item = removed.productItem();
        Timestamp removedAt = timestamp(removed.removedAt());
        touch(transaction, removed.cartId(), removedAt);
        transaction.update("UPDATE cart_items SET quantity = quantity - ?, updated_at = ? WHERE cart_id = ? AND product_id = ?",
                item.quantity(), removedAt, removed.cartId(), item.productId());
        transaction.update("DELETE FROM cart_items WHERE cart_id = ? AND product_id = ? AND quantity <= 0", removed.cartId(), item.productId());
    }

    private static void cartConfirmed(JdbcProjectionTransaction transaction, ShoppingCartConfirmed confirmed) {
        User user = confirmed.user();
        AdditionalInfo additionalInfo = confirmed.additionalInfo();
        transaction.update("UPDATE carts SET status = ?, updated_at = ?, user_id = ?, first_name = ?, last_name = ?, email = ?, " +
                        "additional_info = ?, address_line1 = ?, address_line2 = ? WHERE cart_id = ?",
                ShoppingCartStatus.CONFIRMED.name(), timestamp(confirmed.confirmedAt()), user.id(), user.firstName(), user.lastName(), user.email(),
                additionalInfo.content(), additionalInfo.line1(), additionalInfo.line2(), confirmed.cartId());
    }

    private static void touch(JdbcProjectionTransaction transaction, String cartId, Timestamp updatedAt) {
        transaction.update("UPDATE carts SET updated_at = ? WHERE cart_id = ?", updatedAt, cartId);
    }

    private static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant);
    }
}
