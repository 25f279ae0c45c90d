package com.cartmate.backend.domain.model.payload;

/**
 * Typed content of an {@link com.cartmate.backend.domain.model.A2aRequest}.
 * Each {@link com.cartmate.backend.domain.model.RequestType} accepts exactly one implementation.
 */
public interface RequestPayload {

    /**
     * Chat session the request was raised for, if any.
     */
    String sessionId();
}
