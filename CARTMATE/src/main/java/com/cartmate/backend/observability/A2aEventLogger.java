package com.cartmate.backend.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Machine-parseable log lines for delivery and session lifecycle events.
 */
@Component
@Slf4j
public class A2aEventLogger {

    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_CONVERSATION_ID = "conversationId";
    public static final String MDC_SESSION_ID = "sessionId";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public A2aEventLogger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void setAgentContext(String agentId, String conversationId) {
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
        if (conversationId != null) MDC.put(MDC_CONVERSATION_ID, conversationId);
    }

    public void setSessionContext(String sessionId) {
        if (sessionId != null) MDC.put(MDC_SESSION_ID, sessionId);
    }

    public void clearContext() {
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_CONVERSATION_ID);
        MDC.remove(MDC_SESSION_ID);
    }

    public void logDeliveryRetry(String agentId, String messageId, String receiver, long attempt, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("agentId", agentId);
        data.put("messageId", messageId);
        data.put("receiver", receiver);
        data.put("attempt", attempt);
        if (reason != null) data.put("reason", reason);
        logEvent("delivery_retry", data);
    }

    public void logAckTimeout(String agentId, String messageId, String receiver, int resendAttempt) {
        logEvent("ack_timeout", Map.of(
                "agentId", agentId,
                "messageId", messageId,
                "receiver", receiver,
                "resendAttempt", resendAttempt
        ));
    }

    public void logDeliveryFailed(String agentId, String messageId, String receiver, String messageType) {
        logEvent("delivery_failed", Map.of(
                "agentId", agentId,
                "messageId", messageId,
                "receiver", receiver,
                "messageType", messageType
        ));
    }

    public void logChannelFallback(String receiver, String messageId, String reason) {
        logEvent("channel_fallback", Map.of(
                "receiver", receiver,
                "messageId", messageId,
                "reason", reason
        ));
    }

    public void logReconnection(String sessionId, String outcome, int attempt, long delayMs) {
        logEvent("reconnection", Map.of(
                "sessionId", sessionId,
                "outcome", outcome,
                "attempt", attempt,
                "delayMs", delayMs
        ));
    }

    public void logGatewayError(String sessionId, String code, String severity, String message) {
        Map<String, Object> data = new HashMap<>();
        data.put("sessionId", sessionId);
        data.put("code", code);
        data.put("severity", severity);
        if (message != null) data.put("message", message);
        logEvent("gateway_error", data);
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", clock.instant().toString());
        event.put("service", "cartmate");

        String conversationId = MDC.get(MDC_CONVERSATION_ID);
        if (conversationId != null) event.put("conversationId", conversationId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
