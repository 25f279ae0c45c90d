package com.cartmate.backend.api.websocket.error;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    ErrorSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
