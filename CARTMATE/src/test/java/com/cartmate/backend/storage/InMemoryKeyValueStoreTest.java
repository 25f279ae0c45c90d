package com.cartmate.backend.storage;

import com.cartmate.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryKeyValueStore}.
 */
class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    @DisplayName("should return stored values until they expire")
    void expiresValues() {
        // Given
        store.set("session:s1", "{}", Duration.ofMinutes(5)).block();

        // Then
        StepVerifier.create(store.get("session:s1")).expectNext("{}").verifyComplete();

        clock.advance(Duration.ofMinutes(5));
        StepVerifier.create(store.get("session:s1")).verifyComplete();
        StepVerifier.create(store.exists("session:s1")).expectNext(false).verifyComplete();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("should keep values without a ttl")
    void keepsValuesWithoutTtl() {
        store.set("a2a:agent:ads_001", "{}").block();
        clock.advance(Duration.ofDays(30));

        StepVerifier.create(store.get("a2a:agent:ads_001")).expectNext("{}").verifyComplete();
    }

    @Test
    @DisplayName("should report how many keys a delete removed")
    void deleteCounts() {
        store.set("k", "v").block();

        StepVerifier.create(store.delete("k")).expectNext(1L).verifyComplete();
        StepVerifier.create(store.delete("k")).expectNext(0L).verifyComplete();
    }

    @Test
    @DisplayName("should deliver published messages to current subscribers only")
    void publishSubscribe() {
        // Given
        StepVerifier.create(store.publish("a2a_messages", "early")).expectNext(0L).verifyComplete();
        List<String> received = new CopyOnWriteArrayList<>();
        Disposable subscription = store.subscribe("a2a_messages").subscribe(received::add);

        // When
        StepVerifier.create(store.publish("a2a_messages", "late")).expectNext(1L).verifyComplete();

        // Then
        assertThat(received).containsExactly("late");
        subscription.dispose();
    }
}
