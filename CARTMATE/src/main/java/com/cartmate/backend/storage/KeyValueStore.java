package com.cartmate.backend.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Minimal key-value and publish/subscribe collaborator used by the A2A core and the
 * session store. Durability and sharing across processes depend on the implementation.
 */
public interface KeyValueStore {

    /**
     * @return the value, or empty when absent or expired
     */
    Mono<String> get(String key);

    /**
     * Stores a value, replacing any previous one.
     *
     * @param ttl time to live, or {@code null} to keep the value until deleted
     */
    Mono<Boolean> set(String key, String value, Duration ttl);

    default Mono<Boolean> set(String key, String value) {
        return set(key, value, null);
    }

    /**
     * @return number of keys removed (0 or 1)
     */
    Mono<Long> delete(String key);

    Mono<Boolean> exists(String key);

    /**
     * Fire-and-forget publish.
     *
     * @return number of subscribers that received the message, where known
     */
    Mono<Long> publish(String channel, String message);

    Flux<String> subscribe(String channel);
}
