package com.cartmate.backend.memory.impl;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.memory.ConversationMemory;
import com.cartmate.backend.storage.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversation history kept as one JSON array per session under {@code conversation:{id}}.
 * Writes are read-modify-write and renew the ttl; concurrent writers to the same session
 * may lose an entry.
 */
@Component
@Slf4j
public class KeyValueConversationMemory implements ConversationMemory {

    private static final TypeReference<List<Entry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CartmateProperties.MemoryProperties config;

    public KeyValueConversationMemory(KeyValueStore store, ObjectMapper objectMapper, Clock clock,
                                      CartmateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getMemory();
    }

    @Override
    public Mono<Boolean> store(String sessionId, Entry entry) {
        return getHistory(sessionId)
                .flatMap(history -> {
                    if (entry.getTimestamp() == null) {
                        entry.setTimestamp(clock.instant());
                    }
                    List<Entry> updated = new ArrayList<>(history);
                    updated.add(entry);
                    if (updated.size() > config.getMaxHistory()) {
                        updated = new ArrayList<>(updated.subList(updated.size() - config.getMaxHistory(), updated.size()));
                    }
                    try {
                        return store.set(key(sessionId), objectMapper.writeValueAsString(updated), config.getTtl());
                    } catch (JsonProcessingException e) {
                        return Mono.error(e);
                    }
                })
                .doOnNext(ok -> log.debug("Stored {} message for session {}", entry.getSender(), sessionId))
                .onErrorResume(e -> {
                    log.error("Error storing conversation message for session {}: {}", sessionId, e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<List<Entry>> getHistory(String sessionId) {
        return store.get(key(sessionId))
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, ENTRY_LIST));
                    } catch (JsonProcessingException e) {
                        log.error("Corrupt conversation record {}: {}", sessionId, e.getMessage());
                        return Mono.<List<Entry>>empty();
                    }
                })
                .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<String> getContext(String sessionId) {
        return getHistory(sessionId)
                .map(history -> {
                    if (history.isEmpty()) {
                        return "";
                    }
                    List<Entry> recent = history.subList(Math.max(0, history.size() - config.getContextWindow()),
                            history.size());
                    return recent.stream()
                            .map(entry -> "[" + (entry.getTimestamp() != null ? TIME.format(entry.getTimestamp()) : "")
                                    + "] " + entry.speaker() + ": " + entry.getContent())
                            .collect(Collectors.joining("\n", "Recent conversation history:\n", ""));
                });
    }

    @Override
    public Mono<List<Map<String, Object>>> getRecentProducts(String sessionId) {
        return getHistory(sessionId)
                .map(history -> {
                    Map<Object, Map<String, Object>> byId = new LinkedHashMap<>();
                    history.stream()
                            .filter(entry -> entry.getSender() == Sender.AGENT
                                    && PRODUCT_SEARCH.equals(entry.getMessageType()))
                            .flatMap(entry -> productsOf(entry).stream())
                            .filter(product -> product.get("id") != null)
                            .forEach(product -> byId.putIfAbsent(product.get("id"), product));
                    return List.copyOf(byId.values());
                });
    }

    @Override
    public Mono<Boolean> clear(String sessionId) {
        return store.delete(key(sessionId))
                .map(removed -> true)
                .doOnNext(ok -> log.info("Cleared conversation history for session {}", sessionId))
                .onErrorResume(e -> {
                    log.error("Error clearing conversation history for session {}: {}", sessionId, e.getMessage());
                    return Mono.just(false);
                });
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> productsOf(Entry entry) {
        Object products = entry.getMetadata() != null ? entry.getMetadata().get("products") : null;
        if (!(products instanceof List)) {
            return List.of();
        }
        return ((List<Object>) products).stream()
                .filter(Map.class::isInstance)
                .map(product -> (Map<String, Object>) product)
                .collect(Collectors.toList());
    }

    private String key(String sessionId) {
        return config.getKeyPrefix() + sessionId;
    }
}
