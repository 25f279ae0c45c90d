package com.cartmate.backend.agent;

import com.cartmate.backend.a2a.A2aMessageBus;
import com.cartmate.backend.a2a.AgentCoordinator;
import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.observability.A2aEventLogger;
import com.cartmate.backend.observability.A2aMetrics;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators and delivery settings shared by every agent.
 */
@Getter
@Component
public class AgentRuntime {

    private final AgentCoordinator coordinator;
    private final A2aMessageBus messageBus;
    private final Scheduler scheduler;
    private final Clock clock;
    private final A2aEventLogger eventLogger;
    private final A2aMetrics metrics;
    private final int maxRetries;
    private final Duration retryBackoffBase;
    private final Duration ackTimeout;

    public AgentRuntime(AgentCoordinator coordinator,
                        A2aMessageBus messageBus,
                        @Qualifier("a2aScheduler") Scheduler scheduler,
                        Clock clock,
                        A2aEventLogger eventLogger,
                        A2aMetrics metrics,
                        CartmateProperties properties) {
        this.coordinator = coordinator;
        this.messageBus = messageBus;
        this.scheduler = scheduler;
        this.clock = clock;
        this.eventLogger = eventLogger;
        this.metrics = metrics;
        this.maxRetries = properties.getA2a().getMaxRetries();
        this.retryBackoffBase = properties.getA2a().getRetryBackoffBase();
        this.ackTimeout = properties.getA2a().getAckTimeout();
    }
}
