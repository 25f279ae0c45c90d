package com.cartmate.backend.reasoning;

import reactor.core.publisher.Mono;

/**
 * Classifies a user's chat message into the shopping operation it asks for.
 */
public interface IntentAnalyzer {

    Mono<Intent> analyze(String message, String sessionId);

    enum IntentType {
        CONVERSATION,
        PRODUCT_SEARCH,
        PRICE_COMPARISON,
        CART_MANAGEMENT,
        CHECKOUT
    }

    /**
     * @param searchQuery text to search the catalog with; blank when not a search
     * @param confidence  0..1
     */
    record Intent(IntentType type, String searchQuery, double confidence) {
    }
}
