package com.cartmate.backend.memory.impl;

import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.config.StorageConfig;
import com.cartmate.backend.memory.ConversationMemory;
import com.cartmate.backend.memory.ConversationMemory.Entry;
import com.cartmate.backend.memory.ConversationMemory.Sender;
import com.cartmate.backend.storage.InMemoryKeyValueStore;
import com.cartmate.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeyValueConversationMemory}.
 */
class KeyValueConversationMemoryTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private CartmateProperties properties;
    private KeyValueConversationMemory memory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        properties = new CartmateProperties();
        memory = new KeyValueConversationMemory(store, new StorageConfig().objectMapper(), clock, properties);
    }

    private static Entry search(String... productIds) {
        List<Map<String, Object>> products = new ArrayList<>();
        for (String id : productIds) {
            products.add(Map.of("id", id, "name", "Product " + id));
        }
        return Entry.agentResult("Product Discovery Agent", ConversationMemory.PRODUCT_SEARCH,
                "Found " + productIds.length + " products", Map.of("products", products));
    }

    @Nested
    @DisplayName("History")
    class HistoryTests {

        @Test
        @DisplayName("should keep entries in order with their timestamps")
        void storesInOrder() {
            // Given
            memory.store("s1", Entry.userMessage("hi")).block();
            clock.advance(Duration.ofMinutes(1));

            // When
            StepVerifier.create(memory.store("s1", Entry.assistantMessage("hello"))).expectNext(true).verifyComplete();

            // Then
            List<Entry> history = memory.getHistory("s1").block();
            assertThat(history).extracting(Entry::getSender).containsExactly(Sender.USER, Sender.ASSISTANT);
            assertThat(history).extracting(Entry::getTimestamp).containsExactly(
                    Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:01:00Z"));
            assertThat(store.exists("conversation:s1").block()).isTrue();
        }

        @Test
        @DisplayName("should drop the oldest entries beyond the history limit")
        void capsHistory() {
            properties.getMemory().setMaxHistory(3);

            for (int i = 1; i <= 5; i++) {
                memory.store("s1", Entry.userMessage("message " + i)).block();
            }

            assertThat(memory.getHistory("s1").block()).extracting(Entry::getContent)
                    .containsExactly("message 3", "message 4", "message 5");
        }

        @Test
        @DisplayName("should return an empty history for an unknown session")
        void unknownSession() {
            StepVerifier.create(memory.getHistory("missing"))
                    .assertNext(history -> assertThat(history).isEmpty())
                    .verifyComplete();
            StepVerifier.create(memory.getContext("missing")).expectNext("").verifyComplete();
        }

        @Test
        @DisplayName("should treat a corrupt record as an empty history")
        void corruptRecord() {
            store.set("conversation:s1", "not json").block();

            assertThat(memory.getHistory("s1").block()).isEmpty();
        }

        @Test
        @DisplayName("should expire the history after the ttl")
        void expires() {
            memory.store("s1", Entry.userMessage("hi")).block();

            clock.advance(Duration.ofHours(24));

            assertThat(memory.getHistory("s1").block()).isEmpty();
        }

        @Test
        @DisplayName("should forget the history on clear")
        void clears() {
            memory.store("s1", Entry.userMessage("hi")).block();

            StepVerifier.create(memory.clear("s1")).expectNext(true).verifyComplete();

            assertThat(memory.getHistory("s1").block()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Context")
    class ContextTests {

        @Test
        @DisplayName("should render one line per entry with time and speaker")
        void rendersLines() {
            memory.store("s1", Entry.userMessage("show me mugs")).block();
            clock.advance(Duration.ofMinutes(5));
            memory.store("s1", search("P1")).block();
            memory.store("s1", Entry.assistantMessage("Here you go")).block();

            assertThat(memory.getContext("s1").block()).isEqualTo("Recent conversation history:\n"
                    + "[10:00] User: show me mugs\n"
                    + "[10:05] Product Discovery Agent: Found 1 products\n"
                    + "[10:05] Assistant: Here you go");
        }

        @Test
        @DisplayName("should only render the most recent entries")
        void limitsWindow() {
            properties.getMemory().setContextWindow(2);
            memory.store("s1", Entry.userMessage("one")).block();
            memory.store("s1", Entry.userMessage("two")).block();
            memory.store("s1", Entry.userMessage("three")).block();

            assertThat(memory.getContext("s1").block()).doesNotContain("one").contains("two", "three");
        }
    }

    @Nested
    @DisplayName("Recent products")
    class RecentProductTests {

        @Test
        @DisplayName("should collect products of every search once, first occurrence first")
        void collectsUniqueProducts() {
            memory.store("s1", search("P1", "P2")).block();
            memory.store("s1", Entry.userMessage("more please")).block();
            memory.store("s1", search("P2", "P3")).block();

            assertThat(memory.getRecentProducts("s1").block())
                    .extracting(product -> product.get("id"))
                    .containsExactly("P1", "P2", "P3");
        }

        @Test
        @DisplayName("should ignore results that are not product searches")
        void ignoresOtherResults() {
            memory.store("s1", Entry.agentResult("Price Comparison Agent", ConversationMemory.PRICE_COMPARISON,
                    "Cheapest is P1", Map.of("products", List.of(Map.of("id", "P1"))))).block();

            assertThat(memory.getRecentProducts("s1").block()).isEmpty();
        }
    }
}
