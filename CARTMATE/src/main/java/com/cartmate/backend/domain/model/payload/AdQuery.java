package com.cartmate.backend.domain.model.payload;

import java.util.List;

/**
 * Contextual ad lookup. An empty key list asks for random ads.
 */
public record AdQuery(String sessionId, List<String> contextKeys) implements RequestPayload {

    public AdQuery {
        contextKeys = contextKeys != null ? List.copyOf(contextKeys) : List.of();
    }
}
