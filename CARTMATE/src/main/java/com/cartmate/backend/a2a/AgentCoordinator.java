package com.cartmate.backend.a2a;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.domain.model.AgentRegistration;
import com.cartmate.backend.storage.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of running agents, indexed by id and by type.
 *
 * <p>Registrations are mirrored to the key-value store under {@code a2a:agent:{id}} for
 * observability only. The registry is never rebuilt from storage.
 */
@Service
@Slf4j
public class AgentCoordinator {

    private final Map<String, AgentRegistration> agents = new ConcurrentHashMap<>();
    private final Map<String, List<String>> agentsByType = new ConcurrentHashMap<>();

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public AgentCoordinator(KeyValueStore store, ObjectMapper objectMapper, CartmateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getA2a().getRegistryKeyPrefix();
    }

    /**
     * Registers or replaces an agent. Persistence failures are logged and do not fail the call.
     */
    public Mono<Boolean> register(AgentRegistration registration) {
        return Mono.defer(() -> {
            String agentId = registration.getAgentId();
            AgentRegistration previous = agents.put(agentId, registration);
            if (previous != null && !previous.getAgentType().equals(registration.getAgentType())) {
                removeFromTypeIndex(previous.getAgentType(), agentId);
            }
            agentsByType.compute(registration.getAgentType(), (type, ids) -> {
                List<String> list = ids != null ? ids : new CopyOnWriteArrayList<>();
                if (!list.contains(agentId)) {
                    list.add(agentId);
                }
                return list;
            });

            log.info("Registered agent {} of type {} with capabilities {}",
                    agentId, registration.getAgentType(), registration.getCapabilities());
            return persist(registration).thenReturn(true);
        });
    }

    /**
     * @return false when the agent was not registered
     */
    public Mono<Boolean> deregister(String agentId) {
        return Mono.defer(() -> {
            AgentRegistration removed = agents.remove(agentId);
            if (removed == null) {
                log.warn("Attempted to deregister unknown agent {}", agentId);
                return Mono.just(false);
            }
            removeFromTypeIndex(removed.getAgentType(), agentId);
            log.info("Deregistered agent {}", agentId);

            return store.delete(keyPrefix + agentId)
                    .onErrorResume(e -> {
                        log.warn("Failed to remove stored registration for {}: {}", agentId, e.getMessage());
                        return Mono.just(0L);
                    })
                    .thenReturn(true);
        });
    }

    public Optional<AgentRegistration> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * Oldest still-registered agent of the given type.
     */
    public Optional<AgentRegistration> findByType(String agentType) {
        List<String> ids = agentsByType.get(agentType);
        if (ids == null) {
            return Optional.empty();
        }
        for (String id : ids) {
            AgentRegistration registration = agents.get(id);
            if (registration != null) {
                return Optional.of(registration);
            }
        }
        return Optional.empty();
    }

    public List<AgentRegistration> listAgents() {
        return new ArrayList<>(agents.values());
    }

    public List<String> listAgentTypes() {
        return new ArrayList<>(agentsByType.keySet());
    }

    /**
     * Ids registered under a type, oldest first.
     */
    public List<String> getAgentIdsByType(String agentType) {
        List<String> ids = agentsByType.get(agentType);
        return ids != null ? List.copyOf(ids) : List.of();
    }

    private void removeFromTypeIndex(String agentType, String agentId) {
        agentsByType.computeIfPresent(agentType, (type, ids) -> {
            ids.remove(agentId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private Mono<Boolean> persist(AgentRegistration registration) {
        String json;
        try {
            json = objectMapper.writeValueAsString(registration);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize registration for {}: {}", registration.getAgentId(), e.getMessage());
            return Mono.just(false);
        }
        return store.set(keyPrefix + registration.getAgentId(), json)
                .onErrorResume(e -> {
                    log.warn("Failed to persist registration for {}: {}", registration.getAgentId(), e.getMessage());
                    return Mono.just(false);
                });
    }
}
