package com.cartmate.backend.a2a;

import com.cartmate.backend.domain.model.A2aEvent;
import com.cartmate.backend.domain.model.A2aMessage;
import com.cartmate.backend.domain.model.A2aMessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DirectChannel}.
 */
class DirectChannelTest {

    private DirectChannel channel;

    @BeforeEach
    void setUp() {
        channel = new DirectChannel("agent_a", 3);
    }

    @Test
    @DisplayName("should deliver queued messages in FIFO order")
    void deliversInOrder() {
        // Given
        A2aMessage first = event("first");
        A2aMessage second = event("second");
        channel.offer(first);
        channel.offer(second);

        // When / Then
        StepVerifier.create(channel.receive()).expectNext(first).verifyComplete();
        StepVerifier.create(channel.receive()).expectNext(second).verifyComplete();
        assertThat(channel.size()).isZero();
    }

    @Test
    @DisplayName("should reject offers once at capacity")
    void rejectsWhenFull() {
        assertThat(channel.offer(event("1"))).isTrue();
        assertThat(channel.offer(event("2"))).isTrue();
        assertThat(channel.offer(event("3"))).isTrue();

        assertThat(channel.isFull()).isTrue();
        assertThat(channel.offer(event("4"))).isFalse();
        assertThat(channel.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("should hand a message straight to a waiting consumer")
    void handsOffToWaitingConsumer() {
        // Given
        List<A2aMessage> received = new ArrayList<>();
        Disposable subscription = channel.receive().subscribe(received::add);

        // When
        A2aMessage message = event("direct");
        boolean accepted = channel.offer(message);

        // Then
        assertThat(accepted).isTrue();
        assertThat(received).containsExactly(message);
        assertThat(channel.size()).isZero();
        subscription.dispose();
    }

    @Test
    @DisplayName("should queue again after a waiting consumer cancels")
    void cancelledConsumerReleasesChannel() {
        // Given
        List<A2aMessage> received = new ArrayList<>();
        channel.receive().subscribe(received::add).dispose();

        // When
        channel.offer(event("after-cancel"));

        // Then
        assertThat(received).isEmpty();
        assertThat(channel.size()).isEqualTo(1);
    }

    private static A2aMessage event(String content) {
        return A2aEvent.builder()
                .type(A2aMessageType.NOTIFICATION)
                .sender("sender")
                .receiver("agent_a")
                .content(content)
                .build();
    }
}
