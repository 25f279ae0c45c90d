package com.cartmate.backend.api.v1;

import com.cartmate.backend.a2a.AgentCoordinator;
import com.cartmate.backend.agent.AgentManager;
import com.cartmate.backend.domain.model.AgentRegistration;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the state of the agent system.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Agent status operations")
@Slf4j
public class AgentController {

    private final AgentManager agentManager;
    private final AgentCoordinator coordinator;

    public AgentController(AgentManager agentManager, AgentCoordinator coordinator) {
        this.agentManager = agentManager;
        this.coordinator = coordinator;
    }

    @GetMapping
    @Operation(summary = "Agent status", description = "Running state of every agent")
    @ApiResponse(responseCode = "200", description = "Status retrieved")
    public Mono<Map<String, Object>> getStatus() {
        return Mono.fromSupplier(agentManager::getStatus);
    }

    @GetMapping("/types")
    @Operation(summary = "Agent types", description = "Types with at least one registered agent")
    @ApiResponse(responseCode = "200", description = "Types retrieved")
    public Mono<List<String>> getAgentTypes() {
        return Mono.fromSupplier(coordinator::listAgentTypes);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get registration", description = "Registration of one agent")
    @ApiResponse(responseCode = "200", description = "Agent found")
    @ApiResponse(responseCode = "404", description = "Agent not registered")
    public Mono<ResponseEntity<AgentRegistration>> getAgent(
            @Parameter(description = "Agent ID") @PathVariable String id) {
        return Mono.justOrEmpty(coordinator.getAgent(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
