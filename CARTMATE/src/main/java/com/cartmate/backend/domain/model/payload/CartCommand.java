package com.cartmate.backend.domain.model.payload;

import java.util.List;

/**
 * Cart mutation for a session. Add carries one or more items; update and remove
 * address the items by product id.
 */
public record CartCommand(String sessionId, List<CartItem> items) implements RequestPayload {

    public CartCommand {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static CartCommand single(String sessionId, String productId, int quantity) {
        return new CartCommand(sessionId, List.of(new CartItem(productId, quantity)));
    }

    public record CartItem(String productId, int quantity) {
    }
}
