package com.cartmate.backend.domain.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.SuperBuilder;

import java.util.Map;

/**
 * Reply to an {@link A2aRequest}. {@code error} is set exactly when {@code success} is false.
 */
@Getter
@SuperBuilder
public class A2aResponse extends A2aMessage {

    @NonNull
    private final String requestId;

    private final boolean success;

    @Getter(AccessLevel.NONE)
    private final String error;

    @Builder.Default
    private final Map<String, Object> data = Map.of();

    /**
     * @return null for a successful response, otherwise the failure reason
     */
    public String getError() {
        if (success) {
            return null;
        }
        return error != null && !error.isBlank() ? error : "Unknown error";
    }

    @Override
    public A2aMessageType getType() {
        return A2aMessageType.RESPONSE;
    }

    @Override
    public <R> R accept(A2aMessageVisitor<R> visitor) {
        return visitor.visitResponse(this);
    }

    /**
     * Failed response addressed back to the requester of {@code request}.
     */
    public static A2aResponse failureFor(A2aRequest request, String error) {
        return A2aResponse.builder()
                .sender(request.getReceiver())
                .receiver(request.getSender())
                .requestId(request.getId())
                .conversationId(request.getConversationId())
                .success(false)
                .error(error)
                .build();
    }
}
