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

package org.eventfold.example.domain.shoppingcart.model;

import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemAddedToShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemRemovedFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartConfirmed;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartOpened;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ShoppingCartTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Test
    void opened_event_creates_an_empty_open_cart() {
        ShoppingCart cart = fold(new ShoppingCartOpened("1", NOW));

        assertThat(cart).isEqualTo(new ShoppingCart("1", ShoppingCartStatus.OPENED, List.of(), NOW));
        assertThat(cart.isOpened()).isTrue();
    }

    @Test
    void items_with_same_product_and_price_are_merged_into_one_line() {
        ShoppingCart cart = fold(
                new ShoppingCartOpened("1", NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 2, "10.00"), NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 3, "10.0"), NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 1, "12.00"), NOW));

        assertThat(cart.productItems()).extracting(PricedProductItem::quantity).containsExactly(5, 1);
    }

    @Test
    void removing_all_items_of_a_line_removes_the_line() {
        ShoppingCart cart = fold(
                new ShoppingCartOpened("1", NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 2, "10.00"), NOW),
                new ProductItemAddedToShoppingCart("1", item(2, 1, "5.00"), NOW),
                new ProductItemRemovedFromShoppingCart("1", item(1, 2, "10.00"), NOW));

        assertThat(cart.productItems()).extracting(PricedProductItem::productId).containsExactly(2L);
    }

    @Test
    void removing_some_items_of_a_line_decreases_its_quantity() {
        ShoppingCart cart = fold(
                new ShoppingCartOpened("1", NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 4, "10.00"), NOW),
                new ProductItemRemovedFromShoppingCart("1", item(1, 1, "10.00"), NOW));

        assertThat(cart.findProductItem(1, 3)).hasValueSatisfying(found -> assertThat(found.quantity()).isEqualTo(3));
        assertThat(cart.findProductItem(1, 4)).isEmpty();
    }

    @Test
    void confirmed_event_closes_the_cart_and_keeps_its_items() {
        ShoppingCart cart = fold(
                new ShoppingCartOpened("1", NOW),
                new ProductItemAddedToShoppingCart("1", item(1, 4, "10.00"), NOW),
                new ShoppingCartConfirmed("1", new User(7, "Jane", "Doe", "jane@example.com"), AdditionalInfo.none(), NOW));

        assertThat(cart.status()).isEqualTo(ShoppingCartStatus.CONFIRMED);
        assertThat(cart.isOpened()).isFalse();
        assertThat(cart.productItems()).hasSize(1);
    }

    @Test
    void events_before_the_cart_is_opened_are_rejected() {
        assertThatThrownBy(() -> ShoppingCart.evolve(null, new ProductItemAddedToShoppingCart("1", item(1, 1, "1.00"), NOW)))
                .isExactlyInstanceOf(ShoppingCartException.class)
                .hasMessageContaining("before it was opened")
                .extracting(throwable -> ((ShoppingCartException) throwable).getError())
                .isEqualTo(ShoppingCartError.CART_IS_NOT_OPENED);
    }

    private static ShoppingCart fold(ShoppingCartEvent... events) {
        return Stream.of(events).<ShoppingCart>reduce(null, ShoppingCart::evolve, (first, second) -> second);
    }

    private static PricedProductItem item(long productId, int quantity, String price) {
        return new PricedProductItem(productId, "SKU-" + productId, quantity, new BigDecimal(price), BigDecimal.ZERO);
    }
}
