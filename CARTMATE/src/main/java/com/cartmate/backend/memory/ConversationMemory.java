package com.cartmate.backend.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session chat history. Holds what the user said, what the assistant answered and what
 * the worker agents returned, so later turns can refer back to earlier ones.
 */
public interface ConversationMemory {

    String PRODUCT_SEARCH = "product_search";
    String PRICE_COMPARISON = "price_comparison";
    String TEXT = "text";

    /**
     * Appends an entry; the oldest entries are dropped once the history is full.
     *
     * @return false when the entry could not be stored
     */
    Mono<Boolean> store(String sessionId, Entry entry);

    /**
     * @return the stored entries, oldest first; empty list when none
     */
    Mono<List<Entry>> getHistory(String sessionId);

    /**
     * Recent history as readable lines, one per entry.
     *
     * @return empty string when there is no history
     */
    Mono<String> getContext(String sessionId);

    /**
     * Every product shown by a search in this conversation, first occurrence wins.
     */
    Mono<List<Map<String, Object>>> getRecentProducts(String sessionId);

    Mono<Boolean> clear(String sessionId);

    enum Sender {
        USER,
        ASSISTANT,
        AGENT
    }

    /**
     * One message in the conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class Entry {

        /**
         * Set on store when absent.
         */
        private Instant timestamp;

        @Builder.Default
        private String messageType = TEXT;

        private String content;

        private Sender sender;

        @Builder.Default
        private Map<String, Object> metadata = new HashMap<>();

        public static Entry userMessage(String content) {
            return Entry.builder()
                    .sender(Sender.USER)
                    .content(content)
                    .build();
        }

        public static Entry assistantMessage(String content) {
            return Entry.builder()
                    .sender(Sender.ASSISTANT)
                    .content(content)
                    .build();
        }

        /**
         * Result returned by a worker agent. The agent's display name is kept in the metadata.
         */
        public static Entry agentResult(String agentName, String messageType, String content,
                                        Map<String, Object> metadata) {
            Map<String, Object> meta = new HashMap<>(metadata);
            meta.put("agent_name", agentName);
            return Entry.builder()
                    .sender(Sender.AGENT)
                    .messageType(messageType)
                    .content(content)
                    .metadata(meta)
                    .build();
        }

        public String speaker() {
            if (sender == null) {
                return "Unknown";
            }
            switch (sender) {
                case USER:
                    return "User";
                case ASSISTANT:
                    return "Assistant";
                default:
                    Object name = metadata != null ? metadata.get("agent_name") : null;
                    return name != null ? name.toString() : "Agent";
            }
        }
    }
}
