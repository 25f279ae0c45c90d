package com.cartmate.backend.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-readable agent activity. Observability only: forwarded to backchannel
 * subscribers and never required for correctness.
 */
@Getter
@SuperBuilder
public class FrontendNotification extends A2aMessage {

    @NonNull
    private final NotificationType notificationType;

    private final String agentName;

    private final String agentId;

    private final String content;

    @Override
    public A2aMessageType getType() {
        return A2aMessageType.FRONTEND_NOTIFICATION;
    }

    /**
     * Body of the {@code a2a_message} frame mirrored to backchannel clients.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", getId());
        payload.put("notification_type", notificationType.getValue());
        payload.put("agent_name", agentName);
        payload.put("agent_id", agentId);
        payload.put("content", content);
        payload.put("conversation_id", getConversationId());
        payload.put("timestamp", getTimestamp() != null ? getTimestamp().toString() : null);
        return payload;
    }

    @Override
    public <R> R accept(A2aMessageVisitor<R> visitor) {
        return visitor.visitFrontendNotification(this);
    }

    public enum NotificationType {
        AGENT_THINKING("agent_thinking"),
        AGENT_ACTION("agent_action"),
        AGENT_DELEGATION("agent_delegation"),
        AGENT_RESPONSE("agent_response"),
        AGENT_ERROR("agent_error");

        private final String value;

        NotificationType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
