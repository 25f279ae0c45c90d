package com.cartmate.backend.domain.model.payload;

public record OrderReference(String orderId, String sessionId) implements RequestPayload {
}
