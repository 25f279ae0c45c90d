package com.cartmate.backend.api.v1;

import com.cartmate.backend.memory.ConversationMemory;
import com.cartmate.backend.memory.ConversationMemory.Entry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the conversation history of a chat session.
 */
@RestController
@RequestMapping("/api/v1/conversations")
@Tag(name = "Conversations", description = "Chat history of a session")
@Slf4j
public class ConversationController {

    private final ConversationMemory conversationMemory;

    public ConversationController(ConversationMemory conversationMemory) {
        this.conversationMemory = conversationMemory;
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get history", description = "Stored messages of a session, oldest first")
    @ApiResponse(responseCode = "200", description = "History retrieved")
    public Mono<List<Entry>> getHistory(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        return conversationMemory.getHistory(sessionId);
    }

    @GetMapping("/{sessionId}/context")
    @Operation(summary = "Get context", description = "Recent messages as readable lines")
    @ApiResponse(responseCode = "200", description = "Context retrieved")
    public Mono<Map<String, Object>> getContext(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        return conversationMemory.getContext(sessionId)
                .map(context -> Map.of("session_id", sessionId, "context", context));
    }

    @GetMapping("/{sessionId}/products")
    @Operation(summary = "Get shown products", description = "Every product shown by a search in this session")
    @ApiResponse(responseCode = "200", description = "Products retrieved")
    public Mono<List<Map<String, Object>>> getRecentProducts(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        return conversationMemory.getRecentProducts(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Clear history", description = "Forget the conversation of a session")
    @ApiResponse(responseCode = "204", description = "History cleared")
    public Mono<ResponseEntity<Void>> clear(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        log.info("Clearing conversation history for session {}", sessionId);
        return conversationMemory.clear(sessionId)
                .map(ok -> ResponseEntity.noContent().<Void>build());
    }
}
