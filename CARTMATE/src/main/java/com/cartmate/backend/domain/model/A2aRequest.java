package com.cartmate.backend.domain.model;

import com.cartmate.backend.domain.model.payload.RequestPayload;
import com.cartmate.backend.exception.InvalidMessageException;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.SuperBuilder;

/**
 * Request for another agent to perform an operation. Requires acknowledgment
 * unless the builder says otherwise.
 */
@Getter
@SuperBuilder
public class A2aRequest extends A2aMessage {

    @NonNull
    private final RequestType requestType;

    @NonNull
    private final RequestPayload payload;

    @Override
    public A2aMessageType getType() {
        return A2aMessageType.REQUEST;
    }

    @Override
    public <R> R accept(A2aMessageVisitor<R> visitor) {
        return visitor.visitRequest(this);
    }

    @Override
    protected boolean defaultRequiresAck() {
        return true;
    }

    /**
     * Returns the payload as the given class.
     *
     * @throws InvalidMessageException if the payload is of a different class
     */
    public <T extends RequestPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new InvalidMessageException("Request " + getId() + " of type " + requestType.getValue()
                    + " carries " + payload.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    /**
     * Checks that the payload class matches the one fixed by the request type.
     *
     * @throws InvalidMessageException on mismatch
     */
    public A2aRequest validate() {
        if (!requestType.accepts(payload)) {
            throw new InvalidMessageException("Request type " + requestType.getValue() + " requires "
                    + requestType.getPayloadType().getSimpleName() + " but got "
                    + payload.getClass().getSimpleName());
        }
        return this;
    }
}
