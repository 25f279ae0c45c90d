package com.cartmate.backend.client;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client interface for the product catalog service.
 */
public interface ProductCatalogClient {

    /**
     * Search the catalog. Falls back to the full listing when the query matches nothing.
     *
     * @param query free-text query
     * @return matching products
     */
    Flux<Product> searchProducts(String query);

    Flux<Product> listProducts();

    /**
     * @return the product, or empty when unknown
     */
    Mono<Product> getProduct(String productId);

    Mono<Boolean> isAvailable();

    record Product(
            String id,
            String name,
            String description,
            String picture,
            Money priceUsd,
            List<String> categories
    ) {
    }
}
