package com.cartmate.backend.agent;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Starts and stops every agent in the application context and reports their status.
 */
@Service
@Slf4j
public class AgentManager {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final List<BaseAgent> agents;

    public AgentManager(List<BaseAgent> agents) {
        this.agents = List.copyOf(agents);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        startAll().block();
    }

    @PreDestroy
    public void onShutdown() {
        stopAll().block(SHUTDOWN_TIMEOUT);
    }

    /**
     * Starts agents in order. If one fails, those already started are stopped again
     * and the failure is propagated.
     */
    public Mono<Void> startAll() {
        List<BaseAgent> started = new ArrayList<>();
        return Flux.fromIterable(agents)
                .concatMap(agent -> agent.start().doOnSuccess(ignored -> started.add(agent)))
                .then()
                .doOnSuccess(ignored -> log.info("Started {} agents", started.size()))
                .onErrorResume(e -> {
                    log.error("Failed to start agents, stopping {} already started: {}", started.size(), e.getMessage());
                    return Flux.fromIterable(new ArrayList<>(started))
                            .concatMap(BaseAgent::stop)
                            .then(Mono.error(e));
                });
    }

    public Mono<Void> stopAll() {
        return Flux.fromIterable(agents)
                .concatMap(agent -> agent.stop()
                        .onErrorResume(e -> {
                            log.error("Error stopping agent {}: {}", agent.getAgentId(), e.getMessage());
                            return Mono.empty();
                        }))
                .then()
                .doOnSuccess(ignored -> log.info("Stopped all agents"));
    }

    public Optional<BaseAgent> getAgentById(String agentId) {
        return agents.stream().filter(a -> a.getAgentId().equals(agentId)).findFirst();
    }

    public Optional<BaseAgent> getAgentByType(String agentType) {
        return agents.stream().filter(a -> a.getAgentType().equals(agentType)).findFirst();
    }

    public List<BaseAgent> getAgents() {
        return agents;
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        long running = agents.stream().filter(BaseAgent::isRunning).count();
        status.put("running", running == agents.size() && !agents.isEmpty());
        status.put("agent_count", agents.size());

        Map<String, Object> byId = new LinkedHashMap<>();
        for (BaseAgent agent : agents) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("agent_id", agent.getAgentId());
            info.put("agent_type", agent.getAgentType());
            info.put("name", agent.getDisplayName());
            info.put("capabilities", agent.getCapabilities());
            info.put("running", agent.isRunning());
            info.put("pending_acks", agent.pendingAckCount());
            byId.put(agent.getAgentId(), info);
        }
        status.put("agents", byId);
        return status;
    }
}
