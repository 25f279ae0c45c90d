package com.cartmate.backend.api.websocket;

import com.cartmate.backend.storage.SessionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed operations on top of {@link ConnectionManager}: parses inbound frames and builds the
 * outbound frame types the frontend understands.
 */
@Service
@Slf4j
public class WebSocketGateway {

    private final ConnectionManager connectionManager;
    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebSocketGateway(ConnectionManager connectionManager, SessionManager sessionManager,
                            ObjectMapper objectMapper, Clock clock) {
        this.connectionManager = connectionManager;
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<String> handleConnection(ClientConnection connection, String sessionId, String userId) {
        return connectionManager.connect(connection, sessionId, userId);
    }

    public Mono<String> handleBackchannelConnection(ClientConnection connection, String sessionId, String userId) {
        return connectionManager.connectBackchannel(connection, sessionId, userId);
    }

    public Mono<Void> handleDisconnect(String sessionId) {
        return connectionManager.disconnect(sessionId);
    }

    // --------------------------------------------------------------------------------------------
    // Inbound
    // --------------------------------------------------------------------------------------------

    /**
     * Parses a client frame. A JSON object with a string {@code type} becomes that envelope;
     * anything else is treated as plain text. The session id is stamped when absent and the
     * frame is remembered as the session's {@code last_message}.
     */
    public Mono<GatewayEnvelope> handleMessage(String sessionId, String raw) {
        return Mono.defer(() -> {
            GatewayEnvelope envelope = parse(sessionId, raw);
            Map<String, Object> lastMessage = new LinkedHashMap<>();
            lastMessage.put("type", envelope.getType());
            lastMessage.put("content", envelope.getContent());
            lastMessage.put("timestamp", envelope.getTimestamp().toString());

            Map<String, Object> updates = new LinkedHashMap<>();
            updates.put("last_message", lastMessage);
            updates.put("last_activity", clock.instant().toString());
            return sessionManager.updateContext(sessionId, updates)
                    .onErrorResume(e -> {
                        log.warn("Could not record last message for session {}: {}", sessionId, e.getMessage());
                        return Mono.just(false);
                    })
                    .thenReturn(envelope);
        });
    }

    // --------------------------------------------------------------------------------------------
    // Outbound
    // --------------------------------------------------------------------------------------------

    public Mono<Boolean> sendMessage(String sessionId, String type, Object content) {
        return connectionManager.send(sessionId, envelope(type, content, sessionId));
    }

    public Mono<Boolean> sendError(String sessionId, String error, Map<String, Object> details) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("error", error);
        if (details != null && !details.isEmpty()) {
            content.put("details", details);
        }
        return sendMessage(sessionId, "error", content);
    }

    public Mono<Boolean> sendError(String sessionId, String error) {
        return sendError(sessionId, error, null);
    }

    public Mono<Boolean> sendTypingIndicator(String sessionId, boolean typing) {
        return sendMessage(sessionId, "typing_indicator", Map.of("is_typing", typing));
    }

    public Mono<Boolean> sendAgentCommunication(String sessionId, List<AgentStep> steps) {
        return sendMessage(sessionId, "agent_communication", Map.of("steps", List.copyOf(steps)));
    }

    public Mono<Boolean> updateAgentCommunication(String sessionId, List<AgentStep> steps) {
        return sendMessage(sessionId, "agent_communication_update", Map.of("steps", List.copyOf(steps)));
    }

    /**
     * @return true when at least one backchannel received the frame
     */
    public Mono<Boolean> sendA2aMessageToBackchannel(Object content) {
        return connectionManager.broadcastToBackchannel(envelope("a2a_message", content, null), null)
                .map(sent -> sent > 0)
                .onErrorResume(e -> {
                    log.error("Error sending A2A message to backchannel: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<Integer> broadcastSystemMessage(String message, Set<String> exclude) {
        return connectionManager.broadcast(envelope("system", Map.of("message", message), null), exclude);
    }

    public Map<String, Object> getStats() {
        return connectionManager.getStats();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private GatewayEnvelope envelope(String type, Object content, String sessionId) {
        return GatewayEnvelope.builder()
                .type(type)
                .content(content)
                .sessionId(sessionId)
                .timestamp(clock.instant())
                .build();
    }

    private GatewayEnvelope parse(String sessionId, String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return envelope("text", raw, sessionId);
        }
        if (node == null || !node.isObject() || !node.path("type").isTextual()) {
            return envelope("text", raw, sessionId);
        }
        try {
            Object content = node.hasNonNull("content")
                    ? objectMapper.treeToValue(node.get("content"), Object.class)
                    : null;
            String stampedSession = node.path("session_id").isTextual()
                    ? node.get("session_id").asText()
                    : sessionId;
            return GatewayEnvelope.builder()
                    .type(node.get("type").asText())
                    .content(content)
                    .sessionId(stampedSession)
                    .timestamp(parseTimestamp(node.path("timestamp")))
                    .build();
        } catch (JsonProcessingException e) {
            log.debug("Frame from session {} failed validation, treating as text: {}", sessionId, e.getMessage());
            return envelope("text", raw, sessionId);
        }
    }

    private Instant parseTimestamp(JsonNode node) {
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                log.debug("Ignoring malformed client timestamp {}", node.asText());
            }
        }
        return clock.instant();
    }
}
