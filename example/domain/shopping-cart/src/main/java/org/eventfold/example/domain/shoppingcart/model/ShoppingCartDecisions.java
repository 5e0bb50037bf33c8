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

import org.eventfold.example.domain.shoppingcart.commands.AddProductItemToShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.ConfirmShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.OpenShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.RemoveProductItemFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemAddedToShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ProductItemRemovedFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartConfirmed;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartOpened;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.eventfold.example.domain.shoppingcart.model.ShoppingCartError.CART_IS_NOT_OPENED;
import static org.eventfold.example.domain.shoppingcart.model.ShoppingCartError.NO_PRODUCT_ITEMS;
import static org.eventfold.example.domain.shoppingcart.model.ShoppingCartError.PRODUCT_ITEM_NOT_FOUND;
import static org.eventfold.example.domain.shoppingcart.model.ShoppingCartError.USER_DOES_NOT_EXIST;

/**
 * The business rules of a shopping cart. Each method takes the current state of the cart and a command and returns the resulting events,
 * or throws {@link ShoppingCartException} if the command is not allowed.
 */
public class ShoppingCartDecisions {

    private final ProductPricing productPricing;
    private final UserDirectory userDirectory;
    private final Clock clock;

    public ShoppingCartDecisions(ProductPricing productPricing, UserDirectory userDirectory, Clock clock) {
        requireNonNull(productPricing, ProductPricing.class.getSimpleName() + " cannot be null");
        requireNonNull(userDirectory, UserDirectory.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.productPricing = productPricing;
        this.userDirectory = userDirectory;
        this.clock = clock;
    }

    public List<ShoppingCartEvent> open(OpenShoppingCart command) {
        return List.of(new ShoppingCartOpened(command.cartId(), now()));
    }

    public List<ShoppingCartEvent> addProductItem(ShoppingCart cart, AddProductItemToShoppingCart command) {
        assertIsOpened(cart);
        PricedProductItem pricedProductItem = productPricing.price(command.productItem());
        return List.of(new ProductItemAddedToShoppingCart(command.cartId(), pricedProductItem, now()));
    }

    public List<ShoppingCartEvent> removeProductItem(ShoppingCart cart, RemoveProductItemFromShoppingCart command) {
        assertIsOpened(cart);
        ProductItem productItem = command.productItem();
        PricedProductItem current = cart.findProductItem(productItem.productId(), productItem.quantity())
                .orElseThrow(() -> new ShoppingCartException(PRODUCT_ITEM_NOT_FOUND, "Cart " + cart.id() + " doesn't contain " + productItem.quantity() + " of product " + productItem.productId()));
        return List.of(new ProductItemRemovedFromShoppingCart(command.cartId(), current.withQuantity(productItem.quantity()), now()));
    }

    public List<ShoppingCartEvent> confirm(ShoppingCart cart, ConfirmShoppingCart command) {
        assertIsOpened(cart);
        if (cart.productItems().isEmpty()) {
            throw new ShoppingCartException(NO_PRODUCT_ITEMS, "Cart " + cart.id() + " has no product items");
        }
        User user = userDirectory.findById(command.userId())
                .orElseThrow(() -> new ShoppingCartException(USER_DOES_NOT_EXIST, "User " + command.userId() + " does not exist"));
        return List.of(new ShoppingCartConfirmed(command.cartId(), user, command.additionalInfo(), now()));
    }

    private static void assertIsOpened(ShoppingCart cart) {
        if (!cart.isOpened()) {
            throw new ShoppingCartException(CART_IS_NOT_OPENED, "Cart " + cart.id() + " is " + cart.status());
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
