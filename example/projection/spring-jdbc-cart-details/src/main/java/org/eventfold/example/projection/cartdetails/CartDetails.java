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

import org.eventfold.example.domain.shoppingcart.model.ShoppingCartStatus;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A row of the cart details read model together with its items, ordered by the time they were first added.
 */
public record CartDetails(String cartId, long revision, ShoppingCartStatus status, Instant createdAt, @Nullable Instant updatedAt,
                          @Nullable Customer customer, @Nullable String additionalInfo, @Nullable String addressLine1, @Nullable String addressLine2,
                          List<Item> items) {

    public CartDetails {
        items = List.copyOf(items);
    }

    CartDetails withItems(List<Item> items) {
        return new CartDetails(cartId, revision, status, createdAt, updatedAt, customer, additionalInfo, addressLine1, addressLine2, items);
    }

    public record Customer(long userId, String firstName, String lastName, String email) {
    }

    public record Item(long productId, String sku, BigDecimal price, BigDecimal discount, int quantity) {
    }
}
