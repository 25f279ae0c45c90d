package com.cartmate.backend.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed store, enabled with {@code cartmate.storage.type=redis}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "cartmate.storage", name = "type", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisKeyValueStore(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("Using Redis key-value store");
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        if (ttl == null) {
            return redisTemplate.opsForValue().set(key, value);
        }
        return redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Mono<Long> delete(String key) {
        return redisTemplate.delete(key);
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return redisTemplate.hasKey(key);
    }

    @Override
    public Mono<Long> publish(String channel, String message) {
        return redisTemplate.convertAndSend(channel, message);
    }

    @Override
    public Flux<String> subscribe(String channel) {
        return redisTemplate.listenToChannel(channel)
                .map(ReactiveSubscription.Message::getMessage);
    }
}
