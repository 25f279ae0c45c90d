package com.cartmate.backend.a2a;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.domain.model.A2aMessage;
import com.cartmate.backend.domain.model.A2aMessageType;
import com.cartmate.backend.domain.model.FrontendNotification;
import com.cartmate.backend.exception.DeliveryException;
import com.cartmate.backend.observability.A2aEventLogger;
import com.cartmate.backend.observability.A2aMetrics;
import com.cartmate.backend.storage.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message bus for agent-to-agent communication.
 * Provides:
 * - Point-to-point delivery over bounded per-agent direct channels
 * - Indirect delivery on the {@code agent:{id}} topic when no direct channel can take the message
 * - Broadcast to global listeners and the shared {@code a2a_messages} topic
 * - Mirroring of frontend notifications to backchannel subscribers
 */
@Service
@Slf4j
public class A2aMessageBus {

    private final Map<String, DirectChannel> directChannels = new ConcurrentHashMap<>();
    private final Map<String, GlobalListener> globalListeners = new ConcurrentHashMap<>();
    private final Map<String, FrontendSubscriber> frontendSubscribers = new ConcurrentHashMap<>();

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final A2aMetrics metrics;
    private final A2aEventLogger eventLogger;
    private final CartmateProperties.A2aProperties config;

    public A2aMessageBus(KeyValueStore store, ObjectMapper objectMapper, A2aMetrics metrics,
                         A2aEventLogger eventLogger, CartmateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.eventLogger = eventLogger;
        this.config = properties.getA2a();
        log.info("Initialized A2aMessageBus (direct channel capacity {})", config.getDirectChannelCapacity());
    }

    // --------------------------------------------------------------------------------------------
    // Shared broadcast topic
    // --------------------------------------------------------------------------------------------

    public Mono<Long> publish(String payload) {
        log.debug("Publishing to {}: {}", config.getBroadcastChannel(), payload);
        return store.publish(config.getBroadcastChannel(), payload);
    }

    public Flux<String> subscribe() {
        return store.subscribe(config.getBroadcastChannel());
    }

    // --------------------------------------------------------------------------------------------
    // Point-to-point
    // --------------------------------------------------------------------------------------------

    /**
     * Direct channel for an agent, created on first use.
     */
    public DirectChannel listen(String agentId) {
        return directChannels.computeIfAbsent(agentId,
                id -> new DirectChannel(id, config.getDirectChannelCapacity()));
    }

    /**
     * Closes an agent's direct channel. Later sends to the agent go to its indirect topic.
     *
     * @return true when a channel was open
     */
    public boolean unlisten(String agentId) {
        DirectChannel channel = directChannels.remove(agentId);
        if (channel == null) {
            return false;
        }
        int dropped = channel.size();
        if (dropped > 0) {
            log.warn("Closed direct channel for {} with {} undelivered messages", agentId, dropped);
        } else {
            log.debug("Closed direct channel for {}", agentId);
        }
        return true;
    }

    /**
     * Delivers a message to one agent. Uses the agent's direct channel when it exists and has
     * room, otherwise publishes on the agent's indirect topic. A full channel degrades to the
     * indirect path without failing the call.
     *
     * @return true once the message has been handed off; a {@link DeliveryException} error when
     * it could not be serialized or published
     */
    public Mono<Boolean> sendDirect(String agentId, A2aMessage message) {
        return Mono.defer(() -> {
            DirectChannel channel = directChannels.get(agentId);
            if (channel != null) {
                if (channel.offer(message)) {
                    metrics.getDirectMessages().increment();
                    log.debug("Sent direct message {} ({}) to {}", message.getId(), message.getType(), agentId);
                    forwardToFrontend(message);
                    return Mono.just(true);
                }
                metrics.getChannelFullFallbacks().increment();
                log.warn("Direct channel for {} is full ({} queued), falling back to indirect delivery",
                        agentId, channel.size());
                eventLogger.logChannelFallback(agentId, message.getId(), "channel_full");
            }
            return publishIndirect(agentId, message)
                    .doOnSuccess(ok -> forwardToFrontend(message));
        });
    }

    // --------------------------------------------------------------------------------------------
    // Broadcast
    // --------------------------------------------------------------------------------------------

    /**
     * Notifies every global listener, publishes on the shared topic and, for frontend
     * notifications, forwards to frontend subscribers.
     */
    public Mono<Boolean> broadcast(A2aMessage message) {
        return Mono.defer(() -> {
            metrics.getBroadcasts().increment();
            for (Map.Entry<String, GlobalListener> entry : Map.copyOf(globalListeners).entrySet()) {
                try {
                    entry.getValue().onMessage(message);
                } catch (Exception e) {
                    log.error("Global listener {} failed on message {}: {}",
                            entry.getKey(), message.getId(), e.getMessage());
                }
            }
            return Mono.fromCallable(() -> objectMapper.writeValueAsString(message))
                    .flatMap(this::publish)
                    .doOnSuccess(ignored -> forwardToFrontend(message))
                    .thenReturn(true)
                    .onErrorResume(e -> {
                        log.error("Error broadcasting message {}: {}", message.getId(), e.getMessage());
                        return Mono.just(false);
                    });
        });
    }

    public void registerListener(String listenerId, GlobalListener listener) {
        globalListeners.put(listenerId, listener);
        log.debug("Registered global listener {}", listenerId);
    }

    public void unregisterListener(String listenerId) {
        globalListeners.remove(listenerId);
    }

    public void addFrontendSubscriber(String subscriberId, FrontendSubscriber subscriber) {
        frontendSubscribers.put(subscriberId, subscriber);
        log.debug("Added frontend subscriber {}. Total subscribers: {}", subscriberId, frontendSubscribers.size());
    }

    public void removeFrontendSubscriber(String subscriberId) {
        if (frontendSubscribers.remove(subscriberId) != null) {
            log.debug("Removed frontend subscriber {}. Total subscribers: {}",
                    subscriberId, frontendSubscribers.size());
        }
    }

    public int frontendSubscriberCount() {
        return frontendSubscribers.size();
    }

    /**
     * Get statistics about the message bus.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        Map<String, Integer> queued = new LinkedHashMap<>();
        directChannels.forEach((id, channel) -> queued.put(id, channel.size()));
        stats.put("directChannels", directChannels.size());
        stats.put("queuedMessages", queued);
        stats.put("globalListeners", globalListeners.size());
        stats.put("frontendSubscribers", frontendSubscribers.size());
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Boolean> publishIndirect(String agentId, A2aMessage message) {
        String topic = config.getAgentChannelPrefix() + agentId;
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            return Mono.error(new DeliveryException(message.getId(), agentId,
                    "Could not serialize message " + message.getId(), e));
        }
        return store.publish(topic, json)
                .doOnNext(receivers -> {
                    metrics.getIndirectMessages().increment();
                    log.debug("Sent message {} to {} via {} ({} receivers)", message.getId(), agentId, topic, receivers);
                })
                .thenReturn(true)
                .onErrorMap(e -> !(e instanceof DeliveryException),
                        e -> new DeliveryException(message.getId(), agentId, "Publish to " + topic + " failed", e));
    }

    private void forwardToFrontend(A2aMessage message) {
        if (message.getType() != A2aMessageType.FRONTEND_NOTIFICATION || frontendSubscribers.isEmpty()) {
            return;
        }
        FrontendNotification notification = (FrontendNotification) message;
        log.debug("Forwarding frontend notification to {} subscribers", frontendSubscribers.size());
        for (Map.Entry<String, FrontendSubscriber> entry : Map.copyOf(frontendSubscribers).entrySet()) {
            try {
                entry.getValue().onNotification(notification);
            } catch (Exception e) {
                log.error("Frontend subscriber {} failed, removing it: {}", entry.getKey(), e.getMessage());
                frontendSubscribers.remove(entry.getKey(), entry.getValue());
            }
        }
    }
}
