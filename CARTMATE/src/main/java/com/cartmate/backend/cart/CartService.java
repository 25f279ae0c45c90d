package com.cartmate.backend.cart;

import com.cartmate.backend.client.CartServiceClient;
import com.cartmate.backend.client.CartServiceClient.Cart;
import com.cartmate.backend.client.CartServiceClient.CartLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cart operations of a chat session. The cart service keys carts by user id, derived from the
 * session as {@code user_{sessionId}}.
 *
 * <p>The cart service only supports adding and emptying, so updates and removals rewrite the
 * whole cart.
 */
@Service
@Slf4j
public class CartService {

    private final CartServiceClient cartClient;

    public CartService(CartServiceClient cartClient) {
        this.cartClient = cartClient;
    }

    public static String userIdFor(String sessionId) {
        return "user_" + sessionId;
    }

    public Mono<Boolean> isAvailable() {
        return cartClient.isAvailable();
    }

    public Mono<Cart> getCart(String sessionId) {
        return cartClient.getCart(userIdFor(sessionId));
    }

    public Mono<Void> addItem(String sessionId, String productId, int quantity) {
        return cartClient.addItem(userIdFor(sessionId), productId, quantity);
    }

    /**
     * Sets the quantity of each product. Products not yet in the cart are added; a quantity of
     * zero or less removes the line.
     *
     * @return the cart as rewritten
     */
    public Mono<Cart> updateQuantities(String sessionId, Map<String, Integer> quantities) {
        return rewriteCart(userIdFor(sessionId), lines -> {
            Map<String, Integer> pending = new LinkedHashMap<>(quantities);
            List<CartLine> updated = new ArrayList<>();
            for (CartLine line : lines) {
                Integer quantity = pending.remove(line.productId());
                int newQuantity = quantity != null ? quantity : line.quantity();
                if (newQuantity > 0) {
                    updated.add(new CartLine(line.productId(), newQuantity));
                }
            }
            pending.forEach((productId, quantity) -> {
                if (quantity > 0) {
                    updated.add(new CartLine(productId, quantity));
                }
            });
            return updated;
        });
    }

    /**
     * @return the cart as rewritten
     */
    public Mono<Cart> removeItems(String sessionId, Set<String> productIds) {
        return rewriteCart(userIdFor(sessionId), lines -> lines.stream()
                .filter(line -> !productIds.contains(line.productId()) && line.quantity() > 0)
                .collect(Collectors.toList()));
    }

    public Mono<Void> clear(String sessionId) {
        return cartClient.emptyCart(userIdFor(sessionId));
    }

    private Mono<Cart> rewriteCart(String userId, Function<List<CartLine>, List<CartLine>> change) {
        return cartClient.getCart(userId)
                .flatMap(cart -> {
                    List<CartLine> remaining = change.apply(cart.items());
                    log.info("Rewriting cart of {}: {} -> {} lines", userId, cart.items().size(), remaining.size());
                    return cartClient.emptyCart(userId)
                            .thenMany(Flux.fromIterable(remaining))
                            .concatMap(line -> cartClient.addItem(userId, line.productId(), line.quantity()))
                            .then(Mono.fromSupplier(() -> new Cart(userId, remaining)));
                });
    }
}
