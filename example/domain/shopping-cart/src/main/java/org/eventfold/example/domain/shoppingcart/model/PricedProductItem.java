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

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * A product item with the price it was added to the cart for.
 */
public record PricedProductItem(long productId, String sku, int quantity, BigDecimal price, BigDecimal discount) {
    public PricedProductItem {
        requireNonNull(sku, "Sku cannot be null");
        requireNonNull(price, "Price cannot be null");
        requireNonNull(discount, "Discount cannot be null");
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative, was " + quantity);
        }
    }

    public PricedProductItem withQuantity(int quantity) {
        return new PricedProductItem(productId, sku, quantity, price, discount);
    }

    boolean hasSamePriceAs(PricedProductItem other) {
        return productId == other.productId && price.compareTo(other.price) == 0 && discount.compareTo(other.discount) == 0;
    }
}
