package com.cartmate.backend.domain.model.payload;

public record StyleQuery(String sessionId, String description) implements RequestPayload {
}
