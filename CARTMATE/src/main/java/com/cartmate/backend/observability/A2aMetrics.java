package com.cartmate.backend.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Counters for the message bus, the agent runtime and the gateway.
 */
@Component
@Getter
public class A2aMetrics {

    // ==================== Bus ====================

    private final Counter directMessages;
    private final Counter indirectMessages;
    private final Counter channelFullFallbacks;
    private final Counter broadcasts;

    // ==================== Agent runtime ====================

    private final Counter deliveryRetries;
    private final Counter ackTimeouts;
    private final Counter deliveryFailures;

    // ==================== Gateway ====================

    private final Counter rateLimited;
    private final Counter gatewayErrors;
    private final Counter reconnectionsScheduled;

    public A2aMetrics(MeterRegistry registry) {
        this.directMessages = Counter.builder("cartmate.a2a.messages.direct")
                .description("Messages enqueued on a direct channel")
                .register(registry);
        this.indirectMessages = Counter.builder("cartmate.a2a.messages.indirect")
                .description("Messages published on an agent's indirect topic")
                .register(registry);
        this.channelFullFallbacks = Counter.builder("cartmate.a2a.channel.full")
                .description("Direct sends that fell back to the indirect topic because the channel was full")
                .register(registry);
        this.broadcasts = Counter.builder("cartmate.a2a.messages.broadcast")
                .description("Broadcast messages")
                .register(registry);
        this.deliveryRetries = Counter.builder("cartmate.a2a.delivery.retries")
                .description("Transport-level delivery retries")
                .register(registry);
        this.ackTimeouts = Counter.builder("cartmate.a2a.ack.timeouts")
                .description("Acknowledgments not received in time")
                .register(registry);
        this.deliveryFailures = Counter.builder("cartmate.a2a.delivery.failures")
                .description("Messages given up after exhausting retries")
                .register(registry);
        this.rateLimited = Counter.builder("cartmate.gateway.rate_limited")
                .description("Client messages rejected by the rate limiter")
                .register(registry);
        this.gatewayErrors = Counter.builder("cartmate.gateway.errors")
                .description("Client-facing errors handled")
                .register(registry);
        this.reconnectionsScheduled = Counter.builder("cartmate.gateway.reconnections")
                .description("Reconnection attempts scheduled")
                .register(registry);
    }
}
