package com.cartmate.backend.personalization;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.storage.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Stores personalization profiles as JSON under {@code personalization:{id}}.
 */
@Service
@Slf4j
public class PersonalizationService {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final CartmateProperties.PersonalizationProperties config;

    public PersonalizationService(KeyValueStore store, ObjectMapper objectMapper, CartmateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = properties.getPersonalization();
    }

    /**
     * Replaces the session's profile.
     *
     * @return false when the profile could not be stored
     */
    public Mono<Boolean> save(String sessionId, PersonalizationProfile profile) {
        profile.setSessionId(sessionId);
        try {
            return store.set(key(sessionId), objectMapper.writeValueAsString(profile), config.getTtl())
                    .doOnNext(ok -> log.info("Stored personalization data for session {}", sessionId))
                    .onErrorResume(e -> {
                        log.error("Error storing personalization data for session {}: {}", sessionId, e.getMessage());
                        return Mono.just(false);
                    });
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize personalization data for session {}: {}", sessionId, e.getMessage());
            return Mono.just(false);
        }
    }

    /**
     * @return the profile, or empty when none is stored
     */
    public Mono<PersonalizationProfile> get(String sessionId) {
        return store.get(key(sessionId))
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, PersonalizationProfile.class));
                    } catch (JsonProcessingException e) {
                        log.error("Corrupt personalization record {}: {}", sessionId, e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    /**
     * @return true when a profile existed
     */
    public Mono<Boolean> clear(String sessionId) {
        return store.delete(key(sessionId))
                .map(removed -> removed > 0)
                .doOnNext(removed -> log.info("Cleared personalization data for session {} (existed: {})",
                        sessionId, removed));
    }

    /**
     * One-line summary of a profile for chat replies, e.g.
     * {@code Style Preferences: minimalist, Budget Range: $20 - $80}.
     */
    public static String describe(PersonalizationProfile profile) {
        String style = profile.getStylePreferences() != null && !profile.getStylePreferences().isBlank()
                ? profile.getStylePreferences()
                : "Not specified";
        PersonalizationProfile.BudgetRange budget = profile.getBudgetRange();
        String min = budget != null ? amount(budget.getMin()) : "N/A";
        String max = budget != null ? amount(budget.getMax()) : "N/A";
        return "Style Preferences: " + style + ", Budget Range: $" + min + " - $" + max;
    }

    private static String amount(Double value) {
        if (value == null) {
            return "N/A";
        }
        return value == Math.rint(value)
                ? String.valueOf(value.longValue())
                : String.format(Locale.ROOT, "%.2f", value);
    }

    private String key(String sessionId) {
        return config.getKeyPrefix() + sessionId;
    }
}
