package com.cartmate.backend.client.impl;

import com.cartmate.backend.client.ProductCatalogClient;
import com.cartmate.backend.config.CartmateProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * WebClient-based implementation of ProductCatalogClient.
 * Runs in stub mode, reporting itself unavailable, when no base URL is configured.
 */
@Component
@Slf4j
public class WebClientProductCatalogClient implements ProductCatalogClient {

    private final WebClient webClient;
    private final CartmateProperties.ClientProperties.ServiceClientProperties config;
    private final boolean stubMode;

    public WebClientProductCatalogClient(CartmateProperties properties, WebClient.Builder webClientBuilder) {
        this.config = properties.getClients().getCatalog();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isBlank();

        if (!stubMode) {
            this.webClient = webClientBuilder.clone()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Product catalog client running in stub mode - no actual service connection");
        }
    }

    @Override
    @CircuitBreaker(name = "catalog")
    public Flux<Product> searchProducts(String query) {
        if (stubMode) {
            return Flux.empty();
        }

        return webClient.get()
                .uri(builder -> builder.path("/api/v1/products/search").queryParam("q", query).build())
                .retrieve()
                .bodyToFlux(Product.class)
                .timeout(config.getTimeout())
                .switchIfEmpty(Flux.defer(() -> {
                    log.info("Search for '{}' returned no products, listing the catalog instead", query);
                    return listProducts();
                }))
                .doOnError(e -> log.error("Failed to search products for '{}': {}", query, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "catalog")
    public Flux<Product> listProducts() {
        if (stubMode) {
            return Flux.empty();
        }

        return webClient.get()
                .uri("/api/v1/products")
                .retrieve()
                .bodyToFlux(Product.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.error("Failed to list products: {}", e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "catalog")
    public Mono<Product> getProduct(String productId) {
        if (stubMode) {
            return Mono.empty();
        }

        return webClient.get()
                .uri("/api/v1/products/{id}", productId)
                .retrieve()
                .bodyToMono(Product.class)
                .timeout(config.getTimeout())
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .doOnError(e -> log.error("Failed to get product {}: {}", productId, e.getMessage()));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(!stubMode);
    }
}
