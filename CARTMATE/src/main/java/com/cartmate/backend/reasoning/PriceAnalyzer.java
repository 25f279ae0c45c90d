package com.cartmate.backend.reasoning;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Produces a price comparison for a set of catalog products.
 */
public interface PriceAnalyzer {

    Mono<PriceAnalysis> compare(List<Map<String, Object>> products);

    record PriceAnalysis(
            String summary,
            List<PricePoint> prices,
            String cheapestProductId
    ) {
    }

    record PricePoint(String productId, String name, double price, String currency) {
    }
}
