package com.cartmate.backend.domain.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.SuperBuilder;

/**
 * Untargeted or informational traffic: notifications, synthesized errors,
 * heartbeats and registration announcements.
 */
@Getter
@SuperBuilder
public class A2aEvent extends A2aMessage {

    @NonNull
    private final A2aMessageType type;

    private final String content;

    @Override
    public A2aMessageType getType() {
        if (!type.isEvent()) {
            throw new IllegalStateException("Not an event type: " + type);
        }
        return type;
    }

    @Override
    public <R> R accept(A2aMessageVisitor<R> visitor) {
        return visitor.visitEvent(this);
    }

    public static A2aEvent error(String sender, String receiver, String conversationId, String content) {
        return A2aEvent.builder()
                .type(A2aMessageType.ERROR)
                .sender(sender)
                .receiver(receiver)
                .conversationId(conversationId)
                .content(content)
                .build();
    }
}
