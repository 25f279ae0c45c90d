package com.cartmate.backend.domain.model.payload;

/**
 * Free-text catalog search.
 */
public record ProductQuery(String query, String sessionId, int limit) implements RequestPayload {

    public static final int DEFAULT_LIMIT = 10;

    public ProductQuery(String query, String sessionId) {
        this(query, sessionId, DEFAULT_LIMIT);
    }
}
