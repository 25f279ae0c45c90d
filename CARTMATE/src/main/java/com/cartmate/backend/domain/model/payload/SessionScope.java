package com.cartmate.backend.domain.model.payload;

/**
 * Payload for operations that only need to know which session they act on.
 */
public record SessionScope(String sessionId) implements RequestPayload {
}
