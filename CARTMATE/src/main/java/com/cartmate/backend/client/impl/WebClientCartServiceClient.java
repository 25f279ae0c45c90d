package com.cartmate.backend.client.impl;

import com.cartmate.backend.client.CartServiceClient;
import com.cartmate.backend.config.CartmateProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * WebClient-based implementation of CartServiceClient.
 */
@Component
@Slf4j
public class WebClientCartServiceClient implements CartServiceClient {

    private final WebClient webClient;
    private final CartmateProperties.ClientProperties.ServiceClientProperties config;
    private final boolean stubMode;

    public WebClientCartServiceClient(CartmateProperties properties, WebClient.Builder webClientBuilder) {
        this.config = properties.getClients().getCart();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isBlank();

        if (!stubMode) {
            this.webClient = webClientBuilder.clone()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Cart client running in stub mode - no actual service connection");
        }
    }

    @Override
    @CircuitBreaker(name = "cart")
    public Mono<Void> addItem(String userId, String productId, int quantity) {
        if (stubMode) {
            return Mono.error(new IllegalStateException("Cart service is not configured"));
        }

        return webClient.post()
                .uri("/api/v1/carts/{userId}/items", userId)
                .bodyValue(new CartLine(productId, quantity))
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getTimeout())
                .doOnSuccess(v -> log.debug("Added {} x {} to cart of {}", quantity, productId, userId))
                .doOnError(e -> log.error("Failed to add {} to cart of {}: {}", productId, userId, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "cart")
    public Mono<Cart> getCart(String userId) {
        if (stubMode) {
            return Mono.just(new Cart(userId, List.of()));
        }

        return webClient.get()
                .uri("/api/v1/carts/{userId}", userId)
                .retrieve()
                .bodyToMono(Cart.class)
                .timeout(config.getTimeout())
                .defaultIfEmpty(new Cart(userId, List.of()))
                .doOnError(e -> log.error("Failed to get cart of {}: {}", userId, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "cart")
    public Mono<Void> emptyCart(String userId) {
        if (stubMode) {
            return Mono.empty();
        }

        return webClient.delete()
                .uri("/api/v1/carts/{userId}", userId)
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.error("Failed to empty cart of {}: {}", userId, e.getMessage()));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(!stubMode);
    }
}
