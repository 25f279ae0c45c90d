package com.cartmate.backend.api.websocket;

import com.cartmate.backend.agent.impl.OrchestratorAgent;
import com.cartmate.backend.api.websocket.error.ConnectionErrorHandler;
import com.cartmate.backend.storage.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Routes parsed chat frames to their handlers after applying the per-session rate limit.
 */
@Service
@Slf4j
public class MessageRouter {

    private final WebSocketGateway gateway;
    private final SessionManager sessionManager;
    private final OrchestratorAgent orchestrator;
    private final ConnectionErrorHandler errorHandler;

    public MessageRouter(WebSocketGateway gateway, SessionManager sessionManager, OrchestratorAgent orchestrator,
                         ConnectionErrorHandler errorHandler) {
        this.gateway = gateway;
        this.sessionManager = sessionManager;
        this.orchestrator = orchestrator;
        this.errorHandler = errorHandler;
    }

    /**
     * @return true when the frame was admitted and handled
     */
    public Mono<Boolean> route(String sessionId, GatewayEnvelope envelope) {
        log.info("Routing message type '{}' for session {}", envelope.getType(), sessionId);
        return errorHandler.checkRateLimit(sessionId)
                .flatMap(admitted -> {
                    if (!admitted) {
                        log.warn("Rate limit exceeded for session {}, dropping {} frame", sessionId, envelope.getType());
                        return Mono.just(false);
                    }
                    return dispatch(sessionId, envelope);
                });
    }

    private Mono<Boolean> dispatch(String sessionId, GatewayEnvelope envelope) {
        String type = envelope.getType() != null ? envelope.getType() : "";
        return switch (type) {
            case "new_chat" -> resetChat(sessionId)
                    .flatMap(reset -> reset
                            ? gateway.sendMessage(sessionId, "chat_reset", Map.of("message", "New chat started."))
                            : gateway.sendError(sessionId, "Failed to start new chat."));
            case "new_chat_silent" -> resetChat(sessionId)
                    .doOnNext(reset -> {
                        if (reset) {
                            log.info("Session context silently reset for session {}", sessionId);
                        } else {
                            log.error("Failed to silently reset session context for session {}", sessionId);
                        }
                    });
            case "text" -> handleText(sessionId, envelope.getContent());
            case "ping" -> gateway.sendMessage(sessionId, "pong", Map.of("session_id", sessionId));
            case "ads_request" -> handleAdsRequest(sessionId, envelope.getContent());
            default -> {
                log.warn("No handler for message type '{}'", type);
                yield gateway.sendError(sessionId, "Unknown message type",
                        Map.of("message", "No handler for '" + type + "'"));
            }
        };
    }

    private Mono<Boolean> resetChat(String sessionId) {
        return sessionManager.resetSessionContext(sessionId)
                .flatMap(reset -> orchestrator.clearSessionContext(sessionId).thenReturn(reset));
    }

    private Mono<Boolean> handleText(String sessionId, Object content) {
        if (!(content instanceof String)) {
            log.warn("Received text message with non-string content for session {}", sessionId);
            return gateway.sendError(sessionId, "Invalid message content",
                    Map.of("message", "Expected a string for 'text' message type."));
        }
        if (!orchestrator.isRunning()) {
            log.error("Orchestrator agent not available for session {}", sessionId);
            return gateway.sendError(sessionId, "Service temporarily unavailable",
                    Map.of("message", "The AI assistant is not ready. Please try again in a moment."));
        }
        return orchestrator.handleUserMessage(sessionId, (String) content)
                .flatMap(reply -> reply.isBlank()
                        ? Mono.just(true)
                        : gateway.sendMessage(sessionId, "text", reply));
    }

    private Mono<Boolean> handleAdsRequest(String sessionId, Object content) {
        if (!orchestrator.isRunning()) {
            return gateway.sendError(sessionId, "Service temporarily unavailable");
        }
        return orchestrator.requestAds(sessionId, contextKeys(content));
    }

    @SuppressWarnings("unchecked")
    private static List<String> contextKeys(Object content) {
        Object keys = content instanceof Map ? ((Map<String, Object>) content).get("context_keys") : content;
        if (keys instanceof List) {
            return ((List<Object>) keys).stream()
                    .filter(key -> key != null)
                    .map(String::valueOf)
                    .collect(Collectors.toList());
        }
        if (keys instanceof String && !((String) keys).isBlank()) {
            return List.of((String) keys);
        }
        return List.of();
    }
}
