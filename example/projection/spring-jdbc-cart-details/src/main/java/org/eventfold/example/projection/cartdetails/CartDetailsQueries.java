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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Reads the cart details read model written by {@link CartDetailsProjection}.
 */
public class CartDetailsQueries {
    private static final RowMapper<CartDetails.Item> ITEM_ROW_MAPPER = (rs, rowNum) -> new CartDetails.Item(
            rs.getLong("product_id"), rs.getString("sku"), rs.getBigDecimal("price"), rs.getBigDecimal("discount"), rs.getInt("quantity"));

    private final JdbcTemplate jdbcTemplate;

    public CartDetailsQueries(JdbcTemplate jdbcTemplate) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<CartDetails> findByCartId(String cartId) {
        requireNonNull(cartId, "Cart id cannot be null");
        List<CartDetails> carts = jdbcTemplate.query("SELECT * FROM carts WHERE cart_id = ?", (rs, rowNum) -> cartDetails(rs), cartId);
        if (carts.isEmpty()) {
            return Optional.empty();
        }
        List<CartDetails.Item> items = jdbcTemplate.query("SELECT * FROM cart_items WHERE cart_id = ? ORDER BY created_at, product_id", ITEM_ROW_MAPPER, cartId);
        return Optional.of(carts.get(0).withItems(items));
    }

    private static CartDetails cartDetails(ResultSet rs) throws SQLException {
        long userId = rs.getLong("user_id");
        CartDetails.Customer customer = rs.wasNull() ? null : new CartDetails.Customer(userId, rs.getString("first_name"), rs.getString("last_name"), rs.getString("email"));
        return new CartDetails(rs.getString("cart_id"), rs.getLong("revision"), ShoppingCartStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(), instant(rs.getTimestamp("updated_at")), customer,
                rs.getString("additional_info"), rs.getString("address_line1"), rs.getString("address_line2"), List.of());
    }

    private static @Nullable Instant instant(@Nullable Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
