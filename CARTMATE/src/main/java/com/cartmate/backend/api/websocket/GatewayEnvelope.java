package com.cartmate.backend.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Frame exchanged with chat and backchannel clients:
 * {@code {type, content, session_id, timestamp}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayEnvelope {

    private String type;
    private Object content;
    private String sessionId;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static GatewayEnvelope of(String type, Object content, String sessionId) {
        return GatewayEnvelope.builder()
                .type(type)
                .content(content)
                .sessionId(sessionId)
                .build();
    }

    public static GatewayEnvelope text(String text, String sessionId) {
        return of("text", text, sessionId);
    }
}
