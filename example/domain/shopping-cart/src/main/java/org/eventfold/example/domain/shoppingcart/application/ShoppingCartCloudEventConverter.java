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

package org.eventfold.example.domain.shoppingcart.application;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eventfold.application.converter.CloudEventConverter;
import org.eventfold.application.converter.EventTypeRegistry;
import org.eventfold.application.converter.jackson.JacksonCloudEventConverter;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemAddedToShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemRemovedFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartConfirmed;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartOpened;

import java.net.URI;

import static java.time.ZoneOffset.UTC;

/**
 * Creates the {@link CloudEventConverter} used for shopping cart events. The cart id is used as cloud event subject
 * and the event timestamp as cloud event time.
 */
public final class ShoppingCartCloudEventConverter {
    public static final URI SOURCE = URI.create("urn:eventfold:example:shoppingcart");

    public static final String CART_OPENED = "cart-opened";
    public static final String PRODUCT_ITEM_ADDED = "product-item-added-to-cart";
    public static final String PRODUCT_ITEM_REMOVED = "product-item-removed-from-cart";
    public static final String CART_CONFIRMED = "cart-confirmed";

    private ShoppingCartCloudEventConverter() {
    }

    public static EventTypeRegistry<ShoppingCartEvent> eventTypes() {
        return EventTypeRegistry.<ShoppingCartEvent>builder()
                .register(CART_OPENED, ShoppingCartOpened.class)
                .register(PRODUCT_ITEM_ADDED, ProductItemAddedToShoppingCart.class)
                .register(PRODUCT_ITEM_REMOVED, ProductItemRemovedFromShoppingCart.class)
                .register(CART_CONFIRMED, ShoppingCartConfirmed.class)
                .build();
    }

    public static JsonMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
    }

    public static CloudEventConverter<ShoppingCartEvent> create() {
        return new JacksonCloudEventConverter.Builder<>(objectMapper(), SOURCE, eventTypes())
                .subjectMapper(ShoppingCartEvent::cartId)
                .timeMapper(event -> event.timestamp().atOffset(UTC))
                .build();
    }
}
