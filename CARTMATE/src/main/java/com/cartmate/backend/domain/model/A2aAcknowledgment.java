package com.cartmate.backend.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.SuperBuilder;

/**
 * Confirms receipt of the message identified by {@code ackForMessageId}.
 */
@Getter
@SuperBuilder
public class A2aAcknowledgment extends A2aMessage {

    @NonNull
    private final String ackForMessageId;

    @Builder.Default
    private final boolean success = true;

    private final String error;

    @Override
    public A2aMessageType getType() {
        return A2aMessageType.ACK;
    }

    @Override
    public <R> R accept(A2aMessageVisitor<R> visitor) {
        return visitor.visitAcknowledgment(this);
    }

    public static A2aAcknowledgment of(A2aMessage received, String acknowledgingAgent) {
        return A2aAcknowledgment.builder()
                .sender(acknowledgingAgent)
                .receiver(received.getSender())
                .conversationId(received.getConversationId())
                .ackForMessageId(received.getId())
                .requiresAck(false)
                .build();
    }
}
