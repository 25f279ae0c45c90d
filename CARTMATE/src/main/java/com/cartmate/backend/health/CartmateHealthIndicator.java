package com.cartmate.backend.health;

import com.cartmate.backend.a2a.AgentCoordinator;
import com.cartmate.backend.agent.AgentManager;
import com.cartmate.backend.api.websocket.ConnectionManager;
import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.storage.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the CartMate backend.
 * Reports storage round-trip, agent registration and live sessions.
 */
@Component
@Slf4j
public class CartmateHealthIndicator implements ReactiveHealthIndicator {

    private static final String CHECK_KEY = "health:check";

    private final KeyValueStore store;
    private final AgentManager agentManager;
    private final AgentCoordinator coordinator;
    private final ConnectionManager connectionManager;
    private final CartmateProperties properties;

    public CartmateHealthIndicator(KeyValueStore store, AgentManager agentManager, AgentCoordinator coordinator,
                                   ConnectionManager connectionManager, CartmateProperties properties) {
        this.store = store;
        this.agentManager = agentManager;
        this.coordinator = coordinator;
        this.connectionManager = connectionManager;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return checkStorage()
                .map(storageUp -> {
                    int expected = agentManager.getAgents().size();
                    int registered = coordinator.listAgents().size();
                    boolean agentsUp = registered == expected;

                    Health.Builder builder = storageUp && agentsUp ? Health.up() : Health.down();
                    builder.withDetail("storage", storageUp ? "UP" : "DOWN");
                    builder.withDetail("storageType", properties.getStorage().getType());
                    builder.withDetail("registeredAgents", registered);
                    builder.withDetail("expectedAgents", expected);
                    builder.withDetail("activeSessions", connectionManager.getActiveSessions().size());
                    builder.withDetail("backchannelSessions", connectionManager.getBackchannelSessions().size());
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkStorage() {
        String value = String.valueOf(System.nanoTime());
        return store.set(CHECK_KEY, value, Duration.ofSeconds(10))
                .then(store.get(CHECK_KEY))
                .map(value::equals)
                .defaultIfEmpty(false)
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
