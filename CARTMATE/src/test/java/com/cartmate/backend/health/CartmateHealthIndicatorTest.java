package com.cartmate.backend.health;

import com.cartmate.backend.agent.AgentManager;
import com.cartmate.backend.storage.KeyValueStore;
import com.cartmate.backend.support.A2aTestHarness;
import com.cartmate.backend.support.RecordingAgent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CartmateHealthIndicator}.
 */
class CartmateHealthIndicatorTest {

    private A2aTestHarness harness;
    private RecordingAgent discovery;
    private RecordingAgent cart;
    private AgentManager agentManager;

    @BeforeEach
    void setUp() {
        harness = new A2aTestHarness();
        discovery = harness.startRecordingAgent("product_discovery_001", "product_discovery");
        cart = harness.startRecordingAgent("cart_management_001", "cart_management");
        agentManager = new AgentManager(List.of(discovery, cart));
    }

    @AfterEach
    void tearDown() {
        harness.dispose();
    }

    private CartmateHealthIndicator indicator(KeyValueStore store) {
        return new CartmateHealthIndicator(store, agentManager, harness.coordinator, harness.connectionManager,
                harness.properties);
    }

    @Test
    @DisplayName("should be up when storage works and every agent is registered")
    void up() {
        StepVerifier.create(indicator(harness.store).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("storage", "UP")
                            .containsEntry("storageType", "in-memory")
                            .containsEntry("registeredAgents", 2)
                            .containsEntry("expectedAgents", 2);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be down when an agent is missing from the registry")
    void agentMissing() {
        cart.stop().block();

        StepVerifier.create(indicator(harness.store).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("registeredAgents", 1);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be down when storage fails")
    void storageDown() {
        KeyValueStore store = mock(KeyValueStore.class);
        when(store.set(anyString(), anyString(), any(Duration.class)))
                .thenReturn(Mono.error(new IllegalStateException("Connection refused")));
        when(store.get(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(indicator(store).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("storage", "DOWN");
                })
                .verifyComplete();
    }
}
