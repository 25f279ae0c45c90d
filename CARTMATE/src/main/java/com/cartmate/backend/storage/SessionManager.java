package com.cartmate.backend.storage;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.domain.model.ChatSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Chat sessions persisted as JSON under {@code session:{id}} with a sliding TTL.
 * Every write renews the lease.
 */
@Service
@Slf4j
public class SessionManager {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final String keyPrefix;

    public SessionManager(KeyValueStore store, ObjectMapper objectMapper, Clock clock,
                          CartmateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.getSession().getTtl();
        this.keyPrefix = properties.getSession().getKeyPrefix();
    }

    public Mono<ChatSession> createSession(String userId, String sessionId) {
        Instant now = clock.instant();
        ChatSession session = ChatSession.builder()
                .id(sessionId)
                .userId(userId)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .context(new HashMap<>())
                .build();
        return save(session)
                .thenReturn(session)
                .doOnSuccess(s -> log.info("Created session {} for user {}", sessionId, userId));
    }

    public Mono<ChatSession> getSession(String sessionId) {
        return store.get(key(sessionId))
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, ChatSession.class));
                    } catch (JsonProcessingException e) {
                        log.error("Corrupt session record {}: {}", sessionId, e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    public Mono<Boolean> updateContext(String sessionId, Map<String, Object> updates) {
        return getSession(sessionId)
                .flatMap(session -> {
                    session.getContext().putAll(updates);
                    return save(session);
                })
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.error("Error updating context for session {}: {}", sessionId, e.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<Boolean> resetSessionContext(String sessionId) {
        return getSession(sessionId)
                .flatMap(session -> {
                    session.setContext(new HashMap<>());
                    return save(session);
                })
                .doOnNext(ok -> log.info("Reset context for session {}", sessionId))
                .defaultIfEmpty(false);
    }

    /**
     * Renews the session lease.
     *
     * @return false when the session no longer exists
     */
    public Mono<Boolean> extendSession(String sessionId) {
        return getSession(sessionId)
                .flatMap(this::save)
                .defaultIfEmpty(false);
    }

    public Mono<Boolean> deleteSession(String sessionId) {
        return store.delete(key(sessionId))
                .map(removed -> removed > 0)
                .doOnNext(removed -> log.info("Deleted session {} (existed: {})", sessionId, removed));
    }

    private Mono<Boolean> save(ChatSession session) {
        session.setExpiresAt(clock.instant().plus(ttl));
        try {
            return store.set(key(session.getId()), objectMapper.writeValueAsString(session), ttl);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}
