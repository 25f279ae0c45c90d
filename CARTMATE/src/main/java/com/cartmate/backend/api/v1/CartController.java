package com.cartmate.backend.api.v1;

import com.cartmate.backend.api.dto.CartItemRequest;
import com.cartmate.backend.api.dto.CartQuantityRequest;
import com.cartmate.backend.api.dto.CartResponse;
import com.cartmate.backend.cart.CartService;
import com.cartmate.backend.client.CartServiceClient.Cart;
import com.cartmate.backend.client.CartServiceClient.CartLine;
import com.cartmate.backend.client.ProductCatalogClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * REST controller for the cart of a chat session, for clients that edit the cart directly
 * instead of through the chat.
 */
@RestController
@RequestMapping("/api/v1/cart")
@Tag(name = "Cart", description = "Cart operations for a chat session")
@Slf4j
public class CartController {

    static final String UNAVAILABLE = "Cart service unavailable";

    private final CartService cartService;
    private final ProductCatalogClient catalogClient;

    public CartController(CartService cartService, ProductCatalogClient catalogClient) {
        this.cartService = cartService;
        this.catalogClient = catalogClient;
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get cart", description = "Cart contents with product details from the catalog")
    @ApiResponse(responseCode = "200", description = "Cart retrieved")
    @ApiResponse(responseCode = "503", description = "Cart service unavailable")
    public Mono<ResponseEntity<CartResponse>> getCart(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        return whenAvailable(() -> cartService.getCart(sessionId)
                .flatMap(this::describeCart)
                .map(data -> ResponseEntity.ok(CartResponse.ok("Cart retrieved successfully", data)))
                .onErrorResume(e -> failed(sessionId, "Error retrieving cart", e)));
    }

    @PostMapping("/{sessionId}/items")
    @Operation(summary = "Add item", description = "Add a product to the cart")
    @ApiResponse(responseCode = "200", description = "Item added")
    @ApiResponse(responseCode = "400", description = "Invalid product or quantity")
    @ApiResponse(responseCode = "503", description = "Cart service unavailable")
    public Mono<ResponseEntity<CartResponse>> addItem(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId,
            @Valid @RequestBody CartItemRequest request) {
        log.info("Adding {} x {} to cart of session {}", request.getQuantity(), request.getProductId(), sessionId);
        return whenAvailable(() -> cartService.addItem(sessionId, request.getProductId(), request.getQuantity())
                .then(Mono.fromSupplier(() -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("product_id", request.getProductId());
                    data.put("quantity", request.getQuantity());
                    return ResponseEntity.ok(CartResponse.ok("Added " + request.getQuantity()
                            + " item(s) to cart", data));
                }))
                .onErrorResume(e -> failed(sessionId, "Error adding item", e)));
    }

    @PutMapping("/{sessionId}/items/{productId}")
    @Operation(summary = "Update quantity", description = "Set the quantity of a product; zero removes it")
    @ApiResponse(responseCode = "200", description = "Quantity updated")
    @ApiResponse(responseCode = "400", description = "Invalid quantity")
    @ApiResponse(responseCode = "503", description = "Cart service unavailable")
    public Mono<ResponseEntity<CartResponse>> updateItem(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId,
            @Parameter(description = "Product ID") @PathVariable String productId,
            @Valid @RequestBody CartQuantityRequest request) {
        log.info("Setting quantity of {} to {} in cart of session {}", productId, request.getQuantity(), sessionId);
        return whenAvailable(() -> cartService.updateQuantities(sessionId, Map.of(productId, request.getQuantity()))
                .map(cart -> ResponseEntity.ok(CartResponse.ok("Updated quantity to " + request.getQuantity(),
                        lines(cart))))
                .onErrorResume(e -> failed(sessionId, "Error updating cart", e)));
    }

    @DeleteMapping("/{sessionId}/items/{productId}")
    @Operation(summary = "Remove item", description = "Remove a product from the cart")
    @ApiResponse(responseCode = "200", description = "Item removed")
    @ApiResponse(responseCode = "503", description = "Cart service unavailable")
    public Mono<ResponseEntity<CartResponse>> removeItem(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId,
            @Parameter(description = "Product ID") @PathVariable String productId) {
        log.info("Removing {} from cart of session {}", productId, sessionId);
        return whenAvailable(() -> cartService.removeItems(sessionId, Set.of(productId))
                .map(cart -> ResponseEntity.ok(CartResponse.ok("Item removed from cart", lines(cart))))
                .onErrorResume(e -> failed(sessionId, "Error removing from cart", e)));
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Clear cart", description = "Remove every item from the cart")
    @ApiResponse(responseCode = "200", description = "Cart cleared")
    @ApiResponse(responseCode = "503", description = "Cart service unavailable")
    public Mono<ResponseEntity<CartResponse>> clearCart(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        log.info("Clearing cart of session {}", sessionId);
        return whenAvailable(() -> cartService.clear(sessionId)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(CartResponse.ok("Cart cleared successfully", null))))
                .onErrorResume(e -> failed(sessionId, "Error clearing cart", e)));
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<ResponseEntity<CartResponse>> whenAvailable(Supplier<Mono<ResponseEntity<CartResponse>>> action) {
        return cartService.isAvailable()
                .flatMap(available -> available
                        ? action.get()
                        : Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(CartResponse.failed(UNAVAILABLE))));
    }

    private static Mono<ResponseEntity<CartResponse>> failed(String sessionId, String message, Throwable e) {
        log.error("{} for session {}: {}", message, sessionId, e.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CartResponse.failed(message + ": " + e.getMessage())));
    }

    /**
     * Cart lines joined with their catalog entries. Lines whose product cannot be looked up keep a
     * placeholder name and price.
     */
    private Mono<Map<String, Object>> describeCart(Cart cart) {
        return Flux.fromIterable(cart.items())
                .filter(line -> line.quantity() > 0)
                .concatMap(this::describeLine)
                .collectList()
                .map(items -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("user_id", cart.userId());
                    data.put("items", items);
                    data.put("total_items", cart.totalQuantity());
                    return data;
                });
    }

    private Mono<Map<String, Object>> describeLine(CartLine line) {
        return catalogClient.getProduct(line.productId())
                .map(product -> item(line, product.name(),
                        product.priceUsd() != null ? product.priceUsd().format() : "Price unavailable",
                        product.picture()))
                .onErrorResume(e -> {
                    log.warn("Could not look up product {}: {}", line.productId(), e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(item(line, "Product " + line.productId(), "Price unavailable", ""));
    }

    private static Map<String, Object> item(CartLine line, String name, String price, String picture) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("product_id", line.productId());
        item.put("name", name);
        item.put("price", price);
        item.put("quantity", line.quantity());
        item.put("picture", picture != null ? picture : "");
        return item;
    }

    private static Map<String, Object> lines(Cart cart) {
        List<Map<String, Object>> items = cart.items().stream()
                .map(line -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("product_id", line.productId());
                    item.put("quantity", line.quantity());
                    return item;
                })
                .collect(Collectors.toList());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("items", items);
        data.put("total_items", cart.totalQuantity());
        return data;
    }
}
