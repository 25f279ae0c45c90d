package com.cartmate.backend.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store with per-key expiry and in-process pub/sub.
 * Contents do not survive a restart and are not shared between instances.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "cartmate.storage", name = "type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, Sinks.Many<String>> channels = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        log.info("Using in-memory key-value store");
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key, entry);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return Mono.fromSupplier(() -> {
            Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
            entries.put(key, new Entry(value, expiresAt));
            return true;
        });
    }

    @Override
    public Mono<Long> delete(String key) {
        return Mono.fromSupplier(() -> {
            Entry removed = entries.remove(key);
            return removed != null && !removed.isExpired(clock.instant()) ? 1L : 0L;
        });
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return get(key).hasElement();
    }

    @Override
    public Mono<Long> publish(String channel, String message) {
        return Mono.fromSupplier(() -> {
            Sinks.Many<String> sink = channels.get(channel);
            if (sink == null || sink.currentSubscriberCount() == 0) {
                log.debug("Published to {} with no subscribers", channel);
                return 0L;
            }
            Sinks.EmitResult result = sink.tryEmitNext(message);
            if (result.isFailure()) {
                log.warn("Failed to publish to {}: {}", channel, result);
                return 0L;
            }
            return (long) sink.currentSubscriberCount();
        });
    }

    @Override
    public Flux<String> subscribe(String channel) {
        return channels.computeIfAbsent(channel, c -> Sinks.many().multicast().directBestEffort())
                .asFlux();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
