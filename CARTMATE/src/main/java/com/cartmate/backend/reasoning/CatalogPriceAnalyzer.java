package com.cartmate.backend.reasoning;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks products by their catalog price. Reads {@code price_usd} in the catalog's
 * units/nanos form, or a plain numeric {@code price}.
 */
@Component
@Slf4j
public class CatalogPriceAnalyzer implements PriceAnalyzer {

    @Override
    public Mono<PriceAnalysis> compare(List<Map<String, Object>> products) {
        return Mono.fromSupplier(() -> {
            List<PricePoint> prices = new ArrayList<>();
            for (Map<String, Object> product : products) {
                Double price = priceOf(product);
                if (price == null) {
                    log.debug("Skipping product without a price: {}", product.get("id"));
                    continue;
                }
                prices.add(new PricePoint(
                        String.valueOf(product.get("id")),
                        String.valueOf(product.getOrDefault("name", product.get("id"))),
                        price,
                        currencyOf(product)));
            }
            prices.sort(Comparator.comparingDouble(PricePoint::price));

            if (prices.isEmpty()) {
                return new PriceAnalysis("No prices available to compare.", List.of(), null);
            }
            PricePoint cheapest = prices.get(0);
            PricePoint dearest = prices.get(prices.size() - 1);
            String summary = prices.size() == 1
                    ? String.format(Locale.ROOT, "%s costs %.2f %s.", cheapest.name(), cheapest.price(), cheapest.currency())
                    : String.format(Locale.ROOT, "%s is the best deal at %.2f %s; %s is the most expensive at %.2f %s.",
                            cheapest.name(), cheapest.price(), cheapest.currency(),
                            dearest.name(), dearest.price(), dearest.currency());
            return new PriceAnalysis(summary, List.copyOf(prices), cheapest.productId());
        });
    }

    @SuppressWarnings("unchecked")
    private static Double priceOf(Map<String, Object> product) {
        Object price = product.get("price");
        if (price instanceof Number number) {
            return number.doubleValue();
        }
        Object priceUsd = product.get("price_usd");
        if (priceUsd instanceof Map<?, ?> map) {
            Map<String, Object> money = (Map<String, Object>) map;
            Object units = money.get("units");
            Object nanos = money.get("nanos");
            double value = units instanceof Number u ? u.doubleValue() : parse(units);
            value += (nanos instanceof Number n ? n.doubleValue() : parse(nanos)) / 1_000_000_000d;
            return value;
        }
        return null;
    }

    private static double parse(Object value) {
        if (value == null) {
            return 0d;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            return 0d;
        }
    }

    @SuppressWarnings("unchecked")
    private static String currencyOf(Map<String, Object> product) {
        Object priceUsd = product.get("price_usd");
        if (priceUsd instanceof Map<?, ?> map) {
            Object code = ((Map<String, Object>) map).get("currency_code");
            if (code != null) {
                return code.toString();
            }
        }
        return "USD";
    }
}
