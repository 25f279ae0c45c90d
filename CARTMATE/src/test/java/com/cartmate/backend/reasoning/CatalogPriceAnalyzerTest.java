package com.cartmate.backend.reasoning;

import com.cartmate.backend.reasoning.PriceAnalyzer.PriceAnalysis;
import com.cartmate.backend.reasoning.PriceAnalyzer.PricePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CatalogPriceAnalyzer}.
 */
class CatalogPriceAnalyzerTest {

    private final CatalogPriceAnalyzer analyzer = new CatalogPriceAnalyzer();

    @Test
    @DisplayName("should rank products from cheapest to most expensive")
    void ranksByPrice() {
        // Given
        List<Map<String, Object>> products = List.of(
                product("p1", "Watch", Map.of("currency_code", "USD", "units", 109, "nanos", 990_000_000)),
                product("p2", "Mug", Map.of("currency_code", "USD", "units", 8, "nanos", 990_000_000)),
                product("p3", "Tank Top", Map.of("currency_code", "USD", "units", 18, "nanos", 990_000_000)));

        // When
        PriceAnalysis analysis = analyzer.compare(products).block();

        // Then
        assertThat(analysis.prices()).extracting(PricePoint::productId).containsExactly("p2", "p3", "p1");
        assertThat(analysis.cheapestProductId()).isEqualTo("p2");
        assertThat(analysis.summary())
                .isEqualTo("Mug is the best deal at 8.99 USD; Watch is the most expensive at 109.99 USD.");
    }

    @Test
    @DisplayName("should read a plain numeric price and skip products without one")
    void plainPriceAndMissingPrice() {
        Map<String, Object> plain = new HashMap<>();
        plain.put("id", "p1");
        plain.put("name", "Candle");
        plain.put("price", 12.5);
        Map<String, Object> unpriced = Map.of("id", "p2", "name", "Mystery box");

        PriceAnalysis analysis = analyzer.compare(List.of(plain, unpriced)).block();

        assertThat(analysis.prices()).hasSize(1);
        assertThat(analysis.summary()).isEqualTo("Candle costs 12.50 USD.");
    }

    @Test
    @DisplayName("should parse units given as strings")
    void stringUnits() {
        PriceAnalysis analysis = analyzer.compare(List.of(
                product("p1", "Loafers", Map.of("currency_code", "EUR", "units", "89", "nanos", 0)))).block();

        assertThat(analysis.prices().get(0).price()).isEqualTo(89.0);
        assertThat(analysis.prices().get(0).currency()).isEqualTo("EUR");
    }

    @Test
    @DisplayName("should report when nothing can be compared")
    void emptyInput() {
        PriceAnalysis analysis = analyzer.compare(List.of()).block();

        assertThat(analysis.summary()).isEqualTo("No prices available to compare.");
        assertThat(analysis.prices()).isEmpty();
        assertThat(analysis.cheapestProductId()).isNull();
    }

    private static Map<String, Object> product(String id, String name, Map<String, Object> priceUsd) {
        Map<String, Object> product = new HashMap<>();
        product.put("id", id);
        product.put("name", name);
        product.put("price_usd", priceUsd);
        return product;
    }
}
