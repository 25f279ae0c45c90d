package com.cartmate.backend.domain.model.payload;

public record ProductLookup(String productId, String sessionId) implements RequestPayload {
}
