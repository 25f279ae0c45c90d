package com.cartmate.backend.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Envelope exchanged between agents.
 *
 * <p>The set of concrete kinds is closed: {@link A2aRequest}, {@link A2aResponse},
 * {@link A2aAcknowledgment}, {@link FrontendNotification} and {@link A2aEvent}. Receivers
 * dispatch through {@link #accept(A2aMessageVisitor)} instead of probing the type.
 *
 * <p>All fields are fixed at construction except {@code sender}, which the sending
 * agent runtime stamps just before hand-off.
 */
@Getter
@SuperBuilder
public abstract class A2aMessage {

    @Builder.Default
    private final String id = UUID.randomUUID().toString();

    @Setter
    private volatile String sender;

    private final String receiver;

    @Builder.Default
    private final String conversationId = UUID.randomUUID().toString();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    @Getter(AccessLevel.NONE)
    private final Boolean requiresAck;

    public abstract A2aMessageType getType();

    public abstract <R> R accept(A2aMessageVisitor<R> visitor);

    @JsonProperty("requires_ack")
    public boolean isRequiresAck() {
        return requiresAck != null ? requiresAck : defaultRequiresAck();
    }

    /**
     * Acknowledgment requirement applied when the builder leaves it unset.
     */
    protected boolean defaultRequiresAck() {
        return false;
    }
}
