package com.cartmate.backend.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared plumbing for the chat and backchannel endpoints: query parameters, outbound frames and
 * heartbeats.
 */
@Slf4j
public abstract class SessionWebSocketHandler implements WebSocketHandler {

    static final String SESSION_ID_PARAM = "session_id";
    static final String USER_ID_PARAM = "user_id";

    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    private final Duration heartbeatInterval;

    protected SessionWebSocketHandler(ObjectMapper objectMapper, Clock clock, Duration heartbeatInterval) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.heartbeatInterval = heartbeatInterval;
    }

    protected static String queryParam(WebSocketSession session, String name) {
        return UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst(name);
    }

    /**
     * Frames queued on the connection merged with periodic heartbeats.
     */
    protected Flux<WebSocketMessage> outbound(WebSocketSession session, WebSocketClientConnection connection) {
        Flux<String> heartbeats = Flux.interval(heartbeatInterval)
                .map(tick -> heartbeatFrame());
        return Flux.merge(connection.outbound(), heartbeats)
                .map(session::textMessage);
    }

    private String heartbeatFrame() {
        try {
            return objectMapper.writeValueAsString(GatewayEnvelope.builder()
                    .type("heartbeat")
                    .timestamp(clock.instant())
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize heartbeat: {}", e.getMessage());
            return "{\"type\":\"heartbeat\"}";
        }
    }
}
