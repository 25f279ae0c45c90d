package com.cartmate.backend.api.websocket;

import com.cartmate.backend.api.websocket.error.ConnectionErrorHandler;
import com.cartmate.backend.config.CartmateProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Backchannel endpoint. Streams agent activity to the frontend; the only inbound frame it
 * answers is {@code ping}.
 */
@Component
@Slf4j
public class BackchannelWebSocketHandler extends SessionWebSocketHandler {

    private final WebSocketGateway gateway;
    private final ConnectionManager connectionManager;
    private final ConnectionErrorHandler errorHandler;

    public BackchannelWebSocketHandler(WebSocketGateway gateway, ConnectionManager connectionManager,
                                       ConnectionErrorHandler errorHandler, ObjectMapper objectMapper, Clock clock,
                                       CartmateProperties properties) {
        super(objectMapper, clock, properties.getGateway().getHeartbeatInterval());
        this.gateway = gateway;
        this.connectionManager = connectionManager;
        this.errorHandler = errorHandler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketClientConnection connection = new WebSocketClientConnection(session);
        AtomicReference<String> boundSession = new AtomicReference<>();

        Mono<Void> input = gateway.handleBackchannelConnection(connection,
                        queryParam(session, SESSION_ID_PARAM), queryParam(session, USER_ID_PARAM))
                .flatMapMany(sessionId -> {
                    boundSession.set(sessionId);
                    return session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .concatMap(raw -> isPing(raw)
                                    ? gateway.sendMessage(sessionId, "pong", Map.of("session_id", sessionId))
                                    : Mono.just(false));
                })
                .then();

        return session.send(outbound(session, connection))
                .and(input)
                .doFinally(signal -> {
                    String sessionId = boundSession.get();
                    if (sessionId == null) {
                        return;
                    }
                    log.info("Backchannel for session {} closed: {}", sessionId, signal);
                    connectionManager.release(sessionId, connection)
                            .doOnSuccess(ignored -> {
                                if (!connectionManager.isSessionActive(sessionId)) {
                                    errorHandler.cleanupSession(sessionId);
                                }
                            })
                            .subscribe(
                                    ignored -> { },
                                    e -> log.error("Error cleaning up backchannel {}: {}", sessionId, e.getMessage()));
                });
    }

    private boolean isPing(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null && "ping".equals(node.path("type").asText());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON backchannel frame: {}", raw);
            return false;
        }
    }
}
