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
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The state of a shopping cart, derived from its events by {@link #evolve(ShoppingCart, ShoppingCartEvent)}.
 * Product items with the same product and price are merged into one line.
 */
public record ShoppingCart(String id, ShoppingCartStatus status, List<PricedProductItem> productItems, Instant openedAt) {

    public ShoppingCart {
        requireNonNull(id, "Id cannot be null");
        requireNonNull(status, "Status cannot be null");
        requireNonNull(openedAt, "Opened at cannot be null");
        productItems = List.copyOf(productItems);
    }

    public static ShoppingCart evolve(@Nullable ShoppingCart state, ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened opened) {
            return new ShoppingCart(opened.cartId(), ShoppingCartStatus.OPENED, List.of(), opened.openedAt());
        } else if (state == null) {
            throw new ShoppingCartException(ShoppingCartError.CART_IS_NOT_OPENED, "Shopping cart " + event.cartId() + " received " + event.getClass().getSimpleName() + " before it was opened");
        } else if (event instanceof ProductItemAddedToShoppingCart added) {
            return state.withProductItems(add(state.productItems, added.productItem()));
        } else if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            return state.withProductItems(remove(state.productItems, removed.productItem()));
        } else if (event instanceof ShoppingCartConfirmed) {
            return new ShoppingCart(state.id, ShoppingCartStatus.CONFIRMED, state.productItems, state.openedAt);
        }
        throw new IllegalArgumentException("Unsupported event " + event.getClass().getName());
    }

    public boolean isOpened() {
        return status == ShoppingCartStatus.OPENED;
    }

    /**
     * @return The first line of the product, if it holds at least {@code quantity} items
     */
    public Optional<PricedProductItem> findProductItem(long productId, int quantity) {
        return productItems.stream()
                .filter(item -> item.productId() == productId && item.quantity() >= quantity)
                .findFirst();
    }

    private ShoppingCart withProductItems(List<PricedProductItem> productItems) {
        return new ShoppingCart(id, status, productItems, openedAt);
    }

    private static List<PricedProductItem> add(List<PricedProductItem> productItems, PricedProductItem newItem) {
        List<PricedProductItem> result = new ArrayList<>(productItems.size() + 1);
        boolean merged = false;
        for (PricedProductItem item : productItems) {
            if (!merged && item.hasSamePriceAs(newItem)) {
                result.add(item.withQuantity(item.quantity() + newItem.quantity()));
                merged = true;
            } else {
                result.add(item);
            }
        }
        if (!merged) {
            result.add(newItem);
        }
        return result;
    }

    private static List<PricedProductItem> remove(List<PricedProductItem> productItems, PricedProductItem removedItem) {
        List<PricedProductItem> result = new ArrayList<>(productItems.size());
        boolean removed = false;
        for (PricedProductItem item : productItems) {
            if (!removed && item.hasSamePriceAs(removedItem)) {
                int remaining = item.quantity() - removedItem.quantity();
                if (remaining > 0) {
                    result.add(item.withQuantity(remaining));
                }
                removed = true;
            } else {
                result.add(item);
            }
        }
        return result;
    }
}
