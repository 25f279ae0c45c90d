package com.cartmate.backend.client.impl;

import com.cartmate.backend.client.CheckoutServiceClient;
import com.cartmate.backend.config.CartmateProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * WebClient-based implementation of CheckoutServiceClient.
 */
@Component
@Slf4j
public class WebClientCheckoutServiceClient implements CheckoutServiceClient {

    private final WebClient webClient;
    private final CartmateProperties.ClientProperties.ServiceClientProperties config;
    private final boolean stubMode;

    public WebClientCheckoutServiceClient(CartmateProperties properties, WebClient.Builder webClientBuilder) {
        this.config = properties.getClients().getCheckout();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isBlank();

        if (!stubMode) {
            this.webClient = webClientBuilder.clone()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Checkout client running in stub mode - no actual service connection");
        }
    }

    @Override
    @CircuitBreaker(name = "checkout")
    public Mono<OrderResult> placeOrder(PlaceOrderRequest request) {
        if (stubMode) {
            return Mono.error(new IllegalStateException("Checkout service is not configured"));
        }

        return webClient.post()
                .uri("/api/v1/orders")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(OrderResult.class)
                .timeout(config.getTimeout())
                .doOnSuccess(result -> log.info("Placed order {} for {}", result.orderId(), request.userId()))
                .doOnError(e -> log.error("Failed to place order for {}: {}", request.userId(), e.getMessage()));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(!stubMode);
    }
}
