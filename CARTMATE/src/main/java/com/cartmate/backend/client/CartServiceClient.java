package com.cartmate.backend.client;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client interface for the cart service. Carts are keyed by user id.
 */
public interface CartServiceClient {

    Mono<Void> addItem(String userId, String productId, int quantity);

    Mono<Cart> getCart(String userId);

    Mono<Void> emptyCart(String userId);

    Mono<Boolean> isAvailable();

    record Cart(String userId, List<CartLine> items) {

        public Cart {
            items = items != null ? List.copyOf(items) : List.of();
        }

        public int totalQuantity() {
            return items.stream().mapToInt(CartLine::quantity).sum();
        }
    }

    record CartLine(String productId, int quantity) {
    }
}
