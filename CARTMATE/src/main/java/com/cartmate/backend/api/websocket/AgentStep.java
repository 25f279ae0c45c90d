package com.cartmate.backend.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the agent activity panel shown next to the chat.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStep {

    public static final String CALLING = "calling";
    public static final String PROCESSING = "processing";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String id;
    private String type;
    private String agentName;
    private String message;

    public static AgentStep of(String id, String type, String agentName, String message) {
        return new AgentStep(id, type, agentName, message);
    }
}
