package com.cartmate.backend.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of messages exchanged between agents on the A2A bus.
 */
public enum A2aMessageType {

    /**
     * Request for another agent to perform an operation.
     */
    REQUEST("request"),

    /**
     * Response to a previously received request.
     */
    RESPONSE("response"),

    /**
     * Informational message with no expected reply.
     */
    NOTIFICATION("notification"),

    /**
     * Error report, typically a synthesized delivery failure.
     */
    ERROR("error"),

    /**
     * Liveness signal.
     */
    HEARTBEAT("heartbeat"),

    /**
     * Agent announced itself to the coordinator.
     */
    REGISTER("register"),

    /**
     * Agent removed itself from the coordinator.
     */
    DEREGISTER("deregister"),

    /**
     * Acknowledgment of message receipt.
     */
    ACK("ack"),

    /**
     * Human-readable activity update mirrored to backchannel observers.
     */
    FRONTEND_NOTIFICATION("frontend_notification");

    private final String value;

    A2aMessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isEvent() {
        return this == NOTIFICATION || this == ERROR || this == HEARTBEAT
                || this == REGISTER || this == DEREGISTER;
    }
}
