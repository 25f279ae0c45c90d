package com.cartmate.backend.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Logical chat session held in the key-value store. Outlives individual
 * WebSocket connections so a client can resume it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    private String id;
    private String userId;
    private Instant createdAt;
    private Instant expiresAt;

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
