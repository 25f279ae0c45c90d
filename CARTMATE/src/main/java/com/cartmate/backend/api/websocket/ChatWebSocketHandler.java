package com.cartmate.backend.api.websocket;

import com.cartmate.backend.api.websocket.error.ConnectionErrorHandler;
import com.cartmate.backend.api.websocket.error.ConnectionState;
import com.cartmate.backend.api.websocket.error.ErrorCode;
import com.cartmate.backend.api.websocket.error.GatewayError;
import com.cartmate.backend.config.CartmateProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chat endpoint. Binds the socket to a chat session, runs every inbound frame through the
 * gateway and the router, and starts reconnection handling when the transport fails.
 */
@Component
@Slf4j
public class ChatWebSocketHandler extends SessionWebSocketHandler {

    private final WebSocketGateway gateway;
    private final ConnectionManager connectionManager;
    private final MessageRouter router;
    private final ConnectionErrorHandler errorHandler;

    public ChatWebSocketHandler(WebSocketGateway gateway, ConnectionManager connectionManager, MessageRouter router,
                                ConnectionErrorHandler errorHandler, ObjectMapper objectMapper, Clock clock,
                                CartmateProperties properties) {
        super(objectMapper, clock, properties.getGateway().getHeartbeatInterval());
        this.gateway = gateway;
        this.connectionManager = connectionManager;
        this.router = router;
        this.errorHandler = errorHandler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketClientConnection connection = new WebSocketClientConnection(session);
        AtomicReference<String> boundSession = new AtomicReference<>();

        Mono<Void> input = gateway.handleConnection(connection,
                        queryParam(session, SESSION_ID_PARAM), queryParam(session, USER_ID_PARAM))
                .flatMapMany(sessionId -> {
                    boundSession.set(sessionId);
                    errorHandler.resetReconnectionAttempts(sessionId);
                    return session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .concatMap(raw -> process(sessionId, raw));
                })
                .then();

        return session.send(outbound(session, connection))
                .and(input)
                .doFinally(signal -> onClose(boundSession.get(), connection, signal));
    }

    private Mono<Boolean> process(String sessionId, String raw) {
        log.debug("Received frame from session {}: {}", sessionId, raw);
        return gateway.handleMessage(sessionId, raw)
                .flatMap(envelope -> router.route(sessionId, envelope))
                .onErrorResume(e -> {
                    log.error("Error processing frame from session {}: {}", sessionId, e.getMessage(), e);
                    return errorHandler.handleError(GatewayError.of(ErrorCode.INTERNAL_ERROR, sessionId,
                            "Error processing message", clock.instant()));
                });
    }

    private void onClose(String sessionId, ClientConnection connection, SignalType signal) {
        if (sessionId == null) {
            return;
        }
        log.info("Chat connection for session {} closed: {}", sessionId, signal);
        connectionManager.release(sessionId, connection)
                .then(Mono.defer(() -> {
                    if (connectionManager.isSessionActive(sessionId)) {
                        return Mono.empty();
                    }
                    if (signal == SignalType.ON_ERROR) {
                        errorHandler.setConnectionState(sessionId, ConnectionState.DISCONNECTED);
                        return errorHandler.handleError(GatewayError.of(ErrorCode.CONNECTION_FAILED, sessionId,
                                "Connection lost", clock.instant())).then();
                    }
                    errorHandler.cleanupSession(sessionId);
                    return Mono.empty();
                }))
                .subscribe(
                        ignored -> { },
                        e -> log.error("Error cleaning up session {}: {}", sessionId, e.getMessage()));
    }
}
