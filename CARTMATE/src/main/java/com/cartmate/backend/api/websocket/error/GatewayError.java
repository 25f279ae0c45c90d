package com.cartmate.backend.api.websocket.error;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An error reported to a client session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayError {

    private ErrorCode code;
    private String message;
    private Map<String, Object> details;
    private ErrorSeverity severity;
    private Instant timestamp;
    private String sessionId;
    private boolean recoverable;
    private Integer retryAfter;

    /**
     * Error with the code's default severity and recoverability.
     */
    public static GatewayError of(ErrorCode code, String sessionId, String message, Instant timestamp) {
        return GatewayError.builder()
                .code(code)
                .message(message)
                .severity(code.getDefaultSeverity())
                .recoverable(code.isRecoverable())
                .sessionId(sessionId)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Body of the {@code error} envelope sent to the client.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code.getValue());
        payload.put("message", message);
        payload.put("severity", severity.getValue());
        payload.put("recoverable", recoverable);
        payload.put("timestamp", timestamp != null ? timestamp.toString() : null);
        if (details != null && !details.isEmpty()) {
            payload.put("details", details);
        }
        if (retryAfter != null) {
            payload.put("retry_after", retryAfter);
        }
        return payload;
    }
}
