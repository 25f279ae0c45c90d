package com.cartmate.backend.domain.model.payload;

import java.util.List;
import java.util.Map;

/**
 * Products to compare against market prices. Each entry is the catalog's view of a product.
 */
public record PriceComparisonQuery(String sessionId, List<Map<String, Object>> products) implements RequestPayload {

    public PriceComparisonQuery {
        products = products != null ? List.copyOf(products) : List.of();
    }
}
