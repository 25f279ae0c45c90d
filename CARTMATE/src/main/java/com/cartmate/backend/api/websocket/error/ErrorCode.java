package com.cartmate.backend.api.websocket.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Client-facing error codes with their default severity and whether the client may retry.
 */
public enum ErrorCode {
    CONNECTION_FAILED(ErrorSeverity.HIGH, true),
    AUTHENTICATION_FAILED(ErrorSeverity.HIGH, false),
    SESSION_EXPIRED(ErrorSeverity.MEDIUM, false),
    MESSAGE_INVALID(ErrorSeverity.LOW, true),
    RATE_LIMIT_EXCEEDED(ErrorSeverity.MEDIUM, true),
    INTERNAL_ERROR(ErrorSeverity.CRITICAL, false),
    SERVICE_UNAVAILABLE(ErrorSeverity.HIGH, true),
    TIMEOUT(ErrorSeverity.MEDIUM, true);

    private final ErrorSeverity defaultSeverity;
    private final boolean recoverable;

    ErrorCode(ErrorSeverity defaultSeverity, boolean recoverable) {
        this.defaultSeverity = defaultSeverity;
        this.recoverable = recoverable;
    }

    public ErrorSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
