package com.cartmate.backend.api.websocket.error;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionState {
    CONNECTING("connecting"),
    CONNECTED("connected"),
    DISCONNECTING("disconnecting"),
    DISCONNECTED("disconnected"),
    RECONNECTING("reconnecting"),
    FAILED("failed");

    private final String value;

    ConnectionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
