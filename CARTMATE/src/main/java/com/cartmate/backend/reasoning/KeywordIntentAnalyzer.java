package com.cartmate.backend.reasoning;

import com.cartmate.backend.memory.ConversationMemory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based intent classification. Deterministic and model-free; checkout wins over
 * cart management, which wins over price comparison, which wins over search.
 *
 * <p>A search that names a product already shown in the conversation is a follow-up about that
 * product, not a new search.
 */
@Component
@Slf4j
public class KeywordIntentAnalyzer implements IntentAnalyzer {

    private static final double CONFIDENCE = 0.3;
    private static final int MIN_PRODUCT_NAME_LENGTH = 3;

    private static final List<String> SEARCH_KEYWORDS = List.of("show me", "find", "search", "products", "browse");
    private static final List<String> PRICE_KEYWORDS = List.of("compare", "price", "deal");
    private static final List<String> CART_KEYWORDS = List.of("add to cart", "add these", "put in cart", "add them", "add it");
    private static final List<String> CHECKOUT_KEYWORDS = List.of("checkout", "place order", "buy now", "complete purchase",
            "proceed to checkout");

    private final ConversationMemory conversationMemory;

    public KeywordIntentAnalyzer(ConversationMemory conversationMemory) {
        this.conversationMemory = conversationMemory;
    }

    @Override
    public Mono<Intent> analyze(String message, String sessionId) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        IntentType type = classify(lower);
        if (type != IntentType.PRODUCT_SEARCH) {
            return Mono.just(intent(type, message, sessionId));
        }
        return conversationMemory.getRecentProducts(sessionId)
                .map(products -> products.stream().anyMatch(product -> mentions(lower, product))
                        ? IntentType.CONVERSATION
                        : IntentType.PRODUCT_SEARCH)
                .doOnNext(resolved -> {
                    if (resolved != type) {
                        log.debug("Message in session {} refers to a product already shown", sessionId);
                    }
                })
                .map(resolved -> intent(resolved, message, sessionId));
    }

    private static IntentType classify(String lower) {
        if (containsAny(lower, CHECKOUT_KEYWORDS)) {
            return IntentType.CHECKOUT;
        }
        if (containsAny(lower, CART_KEYWORDS)) {
            return IntentType.CART_MANAGEMENT;
        }
        if (containsAny(lower, PRICE_KEYWORDS)) {
            return IntentType.PRICE_COMPARISON;
        }
        if (containsAny(lower, SEARCH_KEYWORDS)) {
            return IntentType.PRODUCT_SEARCH;
        }
        return IntentType.CONVERSATION;
    }

    private static Intent intent(IntentType type, String message, String sessionId) {
        String query = type == IntentType.PRODUCT_SEARCH ? message : "";
        log.debug("Intent for session {}: {}", sessionId, type);
        return new Intent(type, query, CONFIDENCE);
    }

    private static boolean mentions(String lowerMessage, Map<String, Object> product) {
        Object name = product.get("name");
        if (name == null) {
            return false;
        }
        String lowerName = name.toString().toLowerCase(Locale.ROOT).trim();
        return lowerName.length() >= MIN_PRODUCT_NAME_LENGTH && lowerMessage.contains(lowerName);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
