package com.cartmate.backend.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An agent's entry in the coordinator. Re-registering the same {@code agentId}
 * replaces the previous entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRegistration {

    public static final String STATUS_ACTIVE = "active";

    private String agentId;
    private String agentType;

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    @Builder.Default
    private String status = STATUS_ACTIVE;

    @Builder.Default
    private Instant registeredAt = Instant.now();
}
