package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.client.ProductCatalogClient;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.payload.ProductLookup;
import com.cartmate.backend.domain.model.payload.ProductQuery;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_ACTION;
import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_THINKING;

/**
 * Searches the product catalog on behalf of other agents.
 */
@Component
@Slf4j
public class ProductDiscoveryAgent extends BaseAgent {

    public static final String AGENT_ID = "product_discovery_001";
    public static final String AGENT_TYPE = "product_discovery";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ProductCatalogClient catalogClient;
    private final ObjectMapper objectMapper;

    public ProductDiscoveryAgent(AgentRuntime runtime, ProductCatalogClient catalogClient,
                                 ObjectMapper objectMapper) {
        super(AGENT_ID, AGENT_TYPE, "Product Discovery Agent",
                List.of("search_products", "get_product_details"), runtime);
        this.catalogClient = catalogClient;
        this.objectMapper = objectMapper;
    }

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return switch (request.getRequestType()) {
            case SEARCH_PRODUCTS -> searchProducts(request, request.payloadAs(ProductQuery.class));
            case GET_PRODUCT_DETAILS -> getProductDetails(request, request.payloadAs(ProductLookup.class));
            default -> rejectUnsupported(request);
        };
    }

    private Mono<Boolean> searchProducts(A2aRequest request, ProductQuery query) {
        log.info("Searching for products: {}", query.query());
        return whenCatalogAvailable(request, () -> notifyRequester(request, AGENT_THINKING,
                "Searching for products matching '" + query.query() + "'")
                .then(catalogClient.searchProducts(query.query())
                        .take(query.limit())
                        .map(this::toMap)
                        .collectList())
                .flatMap(products -> {
                    log.info("Found {} products for '{}'", products.size(), query.query());
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("query", query.query());
                    data.put("products", products);
                    data.put("count", products.size());
                    return notifyRequester(request, AGENT_ACTION,
                            "Found " + products.size() + " products for '" + query.query() + "'")
                            .then(reply(request, data));
                })
                .onErrorResume(e -> failRequest(request, "Error searching for products: " + e.getMessage())));
    }

    private Mono<Boolean> getProductDetails(A2aRequest request, ProductLookup lookup) {
        return whenCatalogAvailable(request, () -> notifyRequester(request, AGENT_THINKING,
                "Looking up product " + lookup.productId())
                .then(catalogClient.getProduct(lookup.productId()))
                .flatMap(product -> notifyRequester(request, AGENT_ACTION, "Found " + product.name())
                        .then(reply(request, Map.of("product", toMap(product)))))
                .switchIfEmpty(Mono.defer(() -> failRequest(request, "Product " + lookup.productId() + " not found")))
                .onErrorResume(e -> failRequest(request, "Error fetching product details: " + e.getMessage())));
    }

    private Mono<Boolean> whenCatalogAvailable(A2aRequest request, Supplier<Mono<Boolean>> action) {
        return catalogClient.isAvailable()
                .flatMap(available -> available
                        ? action.get()
                        : failRequest(request, "Product catalog service unavailable"));
    }

    private Map<String, Object> toMap(ProductCatalogClient.Product product) {
        return objectMapper.convertValue(product, MAP_TYPE);
    }
}
