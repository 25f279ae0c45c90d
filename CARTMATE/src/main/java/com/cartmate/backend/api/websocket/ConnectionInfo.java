package com.cartmate.backend.api.websocket;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A live client connection bound to a chat session.
 */
@Data
@Builder
public class ConnectionInfo {

    private final ClientConnection connection;
    private final String sessionId;
    private final String userId;
    private final boolean backchannel;
    private final Instant connectedAt;
    private volatile Instant lastActivity;
}
