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

import org.eventfold.application.command.CommandHandler;
import org.eventfold.application.command.CreateCommand;
import org.eventfold.application.command.UpdateCommand;
import org.eventfold.eventstore.api.ExpectedRevision;
import org.eventfold.eventstore.api.WriteResult;
import org.eventfold.example.domain.shoppingcart.commands.AddProductItemToShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.ConfirmShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.OpenShoppingCart;
import org.eventfold.example.domain.shoppingcart.commands.RemoveProductItemFromShoppingCart;
import org.eventfold.example.domain.shoppingcart.domainevents.ShoppingCartEvent;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCart;
import org.eventfold.example.domain.shoppingcart.model.ShoppingCartDecisions;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Application service for shopping carts. Every cart is stored in its own stream named {@code cart-<cartId>}.
 * Update methods accept the revision the caller last saw, {@code null} means that the command is applied to whatever the current state is.
 */
public class ShoppingCartService {
    private static final Logger log = LoggerFactory.getLogger(ShoppingCartService.class);

    private final CreateCommand<OpenShoppingCart> open;
    private final UpdateCommand<AddProductItemToShoppingCart> addProductItem;
    private final UpdateCommand<RemoveProductItemFromShoppingCart> removeProductItem;
    private final UpdateCommand<ConfirmShoppingCart> confirm;

    public ShoppingCartService(CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler, ShoppingCartDecisions decisions) {
        requireNonNull(commandHandler, CommandHandler.class.getSimpleName() + " cannot be null");
        requireNonNull(decisions, ShoppingCartDecisions.class.getSimpleName() + " cannot be null");
        this.open = commandHandler.create(decisions::open);
        this.addProductItem = commandHandler.update(decisions::addProductItem);
        this.removeProductItem = commandHandler.update(decisions::removeProductItem);
        this.confirm = commandHandler.update(decisions::confirm);
    }

    public static String streamName(String cartId) {
        return "cart-" + cartId;
    }

    public WriteResult open(OpenShoppingCart command) {
        WriteResult result = open.execute(streamName(command.cartId()), command);
        log.info("Opened shopping cart {}", command.cartId());
        return result;
    }

    public WriteResult addProductItem(AddProductItemToShoppingCart command, @Nullable ExpectedRevision expectedRevision) {
        return addProductItem.execute(streamName(command.cartId()), command, expectedRevision);
    }

    public WriteResult removeProductItem(RemoveProductItemFromShoppingCart command, @Nullable ExpectedRevision expectedRevision) {
        return removeProductItem.execute(streamName(command.cartId()), command, expectedRevision);
    }

    public WriteResult confirm(ConfirmShoppingCart command, @Nullable ExpectedRevision expectedRevision) {
        WriteResult result = confirm.execute(streamName(command.cartId()), command, expectedRevision);
        log.info("Confirmed shopping cart {}", command.cartId());
        return result;
    }
}
