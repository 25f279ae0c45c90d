package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.cart.CartService;
import com.cartmate.backend.client.CartServiceClient.Cart;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.payload.CartCommand;
import com.cartmate.backend.domain.model.payload.SessionScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_ACTION;
import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_THINKING;

/**
 * Manages the cart of a chat session through {@link CartService}.
 */
@Component
@Slf4j
public class CartManagementAgent extends BaseAgent {

    public static final String AGENT_ID = "cart_management_001";
    public static final String AGENT_TYPE = "cart_management";

    private final CartService cartService;

    public CartManagementAgent(AgentRuntime runtime, CartService cartService) {
        super(AGENT_ID, AGENT_TYPE, "Cart Management Agent",
                List.of("add_to_cart", "remove_from_cart", "get_cart", "clear_cart", "update_quantity"), runtime);
        this.cartService = cartService;
    }

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return switch (request.getRequestType()) {
            case ADD_TO_CART -> addToCart(request, request.payloadAs(CartCommand.class));
            case UPDATE_CART_ITEM -> updateCartItem(request, request.payloadAs(CartCommand.class));
            case REMOVE_FROM_CART -> removeFromCart(request, request.payloadAs(CartCommand.class));
            case GET_CART -> getCart(request, request.payloadAs(SessionScope.class));
            case CLEAR_CART -> clearCart(request, request.payloadAs(SessionScope.class));
            default -> rejectUnsupported(request);
        };
    }

    // --------------------------------------------------------------------------------------------
    // Operations
    // --------------------------------------------------------------------------------------------

    private Mono<Boolean> addToCart(A2aRequest request, CartCommand command) {
        if (command.items().isEmpty()) {
            return failRequest(request, "No items to add to cart");
        }
        List<Map<String, Object>> added = new ArrayList<>();
        List<Map<String, Object>> failed = new ArrayList<>();

        return whenCartAvailable(request, () -> notifyRequester(request, AGENT_THINKING, "Adding items to cart...")
                .thenMany(Flux.fromIterable(command.items()))
                .concatMap(item -> {
                    if (item.productId() == null || item.productId().isBlank() || item.quantity() <= 0) {
                        failed.add(itemMap(item.productId(), item.quantity()));
                        return Mono.<Void>empty();
                    }
                    return cartService.addItem(command.sessionId(), item.productId(), item.quantity())
                            .doOnSuccess(ignored -> added.add(itemMap(item.productId(), item.quantity())))
                            .onErrorResume(e -> {
                                log.error("Failed to add product {} to cart of session {}: {}", item.productId(),
                                        command.sessionId(), e.getMessage());
                                failed.add(itemMap(item.productId(), item.quantity()));
                                return Mono.empty();
                            });
                })
                .then(Mono.defer(() -> {
                    if (added.isEmpty()) {
                        return failRequest(request, "Failed to add items to cart");
                    }
                    String summary = "Added " + added.size() + " item(s) to cart"
                            + (failed.isEmpty() ? "" : " (" + failed.size() + " failed)");
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("added_items", added);
                    data.put("failed_items", failed);
                    data.put("total_added", added.size());
                    return notifyRequester(request, AGENT_ACTION, summary).then(reply(request, data));
                })));
    }

    private Mono<Boolean> updateCartItem(A2aRequest request, CartCommand command) {
        if (command.items().isEmpty()) {
            return failRequest(request, "No item to update");
        }
        Map<String, Integer> quantities = command.items().stream()
                .collect(Collectors.toMap(CartCommand.CartItem::productId, CartCommand.CartItem::quantity,
                        (first, second) -> second, LinkedHashMap::new));

        return whenCartAvailable(request, () -> notifyRequester(request, AGENT_THINKING, "Updating cart item...")
                .then(cartService.updateQuantities(command.sessionId(), quantities))
                .flatMap(cart -> {
                    String message = command.items().size() == 1
                            ? "Updated quantity to " + command.items().get(0).quantity()
                            : "Updated " + command.items().size() + " cart items";
                    return notifyRequester(request, AGENT_ACTION, message)
                            .then(reply(request, cartData(cart, message)));
                })
                .onErrorResume(e -> failRequest(request, "Error updating cart: " + e.getMessage())));
    }

    private Mono<Boolean> removeFromCart(A2aRequest request, CartCommand command) {
        Set<String> productIds = command.items().stream()
                .map(CartCommand.CartItem::productId)
                .collect(Collectors.toSet());
        if (productIds.isEmpty()) {
            return failRequest(request, "No item to remove");
        }
        return whenCartAvailable(request, () -> notifyRequester(request, AGENT_THINKING, "Removing item from cart...")
                .then(cartService.removeItems(command.sessionId(), productIds))
                .flatMap(cart -> notifyRequester(request, AGENT_ACTION, "Item removed from cart")
                        .then(reply(request, cartData(cart, "Item removed from cart"))))
                .onErrorResume(e -> failRequest(request, "Error removing from cart: " + e.getMessage())));
    }

    private Mono<Boolean> getCart(A2aRequest request, SessionScope scope) {
        return whenCartAvailable(request, () -> notifyRequester(request, AGENT_THINKING, "Retrieving cart contents...")
                .then(cartService.getCart(scope.sessionId()))
                .flatMap(cart -> notifyRequester(request, AGENT_ACTION,
                                "Cart has " + cart.totalQuantity() + " item(s)")
                        .then(reply(request, cartData(cart, null))))
                .onErrorResume(e -> failRequest(request, "Error retrieving cart: " + e.getMessage())));
    }

    private Mono<Boolean> clearCart(A2aRequest request, SessionScope scope) {
        return whenCartAvailable(request, () -> notifyRequester(request, AGENT_THINKING, "Clearing cart...")
                .then(cartService.clear(scope.sessionId()))
                .then(notifyRequester(request, AGENT_ACTION, "Cart cleared"))
                .then(reply(request, Map.of("message", "Cart cleared")))
                .onErrorResume(e -> failRequest(request, "Error clearing cart: " + e.getMessage())));
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Boolean> whenCartAvailable(A2aRequest request, Supplier<Mono<Boolean>> action) {
        return cartService.isAvailable()
                .flatMap(available -> available
                        ? action.get()
                        : failRequest(request, "Cart service unavailable"));
    }

    private static Map<String, Object> cartData(Cart cart, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (message != null) {
            data.put("message", message);
        }
        data.put("items", cart.items().stream()
                .map(line -> itemMap(line.productId(), line.quantity()))
                .collect(Collectors.toList()));
        data.put("total_quantity", cart.totalQuantity());
        return data;
    }

    private static Map<String, Object> itemMap(String productId, int quantity) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("product_id", productId);
        item.put("quantity", quantity);
        return item;
    }
}
