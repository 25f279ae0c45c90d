package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.payload.PriceComparisonQuery;
import com.cartmate.backend.reasoning.PriceAnalyzer;
import com.cartmate.backend.reasoning.PriceAnalyzer.PriceAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_ACTION;
import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_THINKING;

@Component
@Slf4j
public class PriceComparisonAgent extends BaseAgent {

    public static final String AGENT_ID = "price_comparison_001";
    public static final String AGENT_TYPE = "price_comparison";

    private final PriceAnalyzer priceAnalyzer;

    public PriceComparisonAgent(AgentRuntime runtime, PriceAnalyzer priceAnalyzer) {
        super(AGENT_ID, AGENT_TYPE, "Price Comparison Agent",
                List.of("compare_prices", "price_analysis", "deal_finding"), runtime);
        this.priceAnalyzer = priceAnalyzer;
    }

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return switch (request.getRequestType()) {
            case COMPARE_PRICES -> comparePrices(request, request.payloadAs(PriceComparisonQuery.class));
            default -> rejectUnsupported(request);
        };
    }

    private Mono<Boolean> comparePrices(A2aRequest request, PriceComparisonQuery query) {
        if (query.products().isEmpty()) {
            return failRequest(request, "No products to compare");
        }
        return notifyRequester(request, AGENT_THINKING, "Comparing prices for " + query.products().size() + " product(s)...")
                .then(priceAnalyzer.compare(query.products()))
                .flatMap(analysis -> notifyRequester(request, AGENT_ACTION, analysis.summary())
                        .then(reply(request, toData(analysis))))
                .onErrorResume(e -> failRequest(request, "Error comparing prices: " + e.getMessage()));
    }

    private static Map<String, Object> toData(PriceAnalysis analysis) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("summary", analysis.summary());
        data.put("cheapest_product_id", analysis.cheapestProductId());
        data.put("prices", analysis.prices().stream()
                .map(point -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("product_id", point.productId());
                    entry.put("name", point.name());
                    entry.put("price", point.price());
                    entry.put("currency", point.currency());
                    return entry;
                })
                .collect(Collectors.toList()));
        return data;
    }
}
