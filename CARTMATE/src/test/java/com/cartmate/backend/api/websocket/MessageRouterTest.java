package com.cartmate.backend.api.websocket;

import com.cartmate.backend.agent.impl.OrchestratorAgent;
import com.cartmate.backend.api.websocket.error.ConnectionErrorHandler;
import com.cartmate.backend.storage.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MessageRouter}.
 */
@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

    @Mock
    private WebSocketGateway gateway;

    @Mock
    private SessionManager sessionManager;

    @Mock
    private OrchestratorAgent orchestrator;

    @Mock
    private ConnectionErrorHandler errorHandler;

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter(gateway, sessionManager, orchestrator, errorHandler);
        lenient().when(errorHandler.checkRateLimit(anyString())).thenReturn(Mono.just(true));
        lenient().when(gateway.sendMessage(anyString(), anyString(), any())).thenReturn(Mono.just(true));
        lenient().when(gateway.sendError(anyString(), anyString(), anyMap())).thenReturn(Mono.just(true));
        lenient().when(gateway.sendError(anyString(), anyString())).thenReturn(Mono.just(true));
    }

    @Test
    @DisplayName("should drop a frame once the session is rate limited")
    void rateLimited() {
        // Given
        when(errorHandler.checkRateLimit("s1")).thenReturn(Mono.just(false));

        // When / Then
        StepVerifier.create(router.route("s1", GatewayEnvelope.text("hello", "s1")))
                .expectNext(false)
                .verifyComplete();
        verify(orchestrator, never()).handleUserMessage(anyString(), anyString());
        verify(gateway, never()).sendMessage(anyString(), anyString(), any());
    }

    @Nested
    @DisplayName("Text messages")
    class TextTests {

        @Test
        @DisplayName("should send the orchestrator's reply back as text")
        void repliesWithText() {
            // Given
            when(orchestrator.isRunning()).thenReturn(true);
            when(orchestrator.handleUserMessage("s1", "hi")).thenReturn(Mono.just("Hello! How can I help?"));

            // When
            StepVerifier.create(router.route("s1", GatewayEnvelope.text("hi", "s1")))
                    .expectNext(true)
                    .verifyComplete();

            // Then
            verify(gateway).sendMessage("s1", "text", "Hello! How can I help?");
        }

        @Test
        @DisplayName("should send nothing when the reply was already streamed")
        void blankReplyIsNotSent() {
            when(orchestrator.isRunning()).thenReturn(true);
            when(orchestrator.handleUserMessage("s1", "show me shoes")).thenReturn(Mono.just(""));

            StepVerifier.create(router.route("s1", GatewayEnvelope.text("show me shoes", "s1")))
                    .expectNext(true)
                    .verifyComplete();

            verify(gateway, never()).sendMessage(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("should reject non-string content")
        void rejectsNonStringContent() {
            router.route("s1", GatewayEnvelope.of("text", Map.of("text", "hi"), "s1")).block();

            verify(gateway).sendError(eq("s1"), eq("Invalid message content"), anyMap());
            verify(orchestrator, never()).handleUserMessage(anyString(), anyString());
        }

        @Test
        @DisplayName("should report the assistant unavailable while the orchestrator is stopped")
        void orchestratorStopped() {
            when(orchestrator.isRunning()).thenReturn(false);

            router.route("s1", GatewayEnvelope.text("hi", "s1")).block();

            verify(gateway).sendError(eq("s1"), eq("Service temporarily unavailable"), anyMap());
        }
    }

    @Nested
    @DisplayName("Control messages")
    class ControlTests {

        @Test
        @DisplayName("should answer ping with pong")
        void pingPong() {
            router.route("s1", GatewayEnvelope.of("ping", null, "s1")).block();

            verify(gateway).sendMessage("s1", "pong", Map.of("session_id", "s1"));
        }

        @Test
        @DisplayName("should report unknown message types")
        void unknownType() {
            router.route("s1", GatewayEnvelope.of("dance", null, "s1")).block();

            verify(gateway).sendError("s1", "Unknown message type", Map.of("message", "No handler for 'dance'"));
        }

        @Test
        @DisplayName("should reset the session and confirm a new chat")
        void newChat() {
            // Given
            when(sessionManager.resetSessionContext("s1")).thenReturn(Mono.just(true));
            when(orchestrator.clearSessionContext("s1")).thenReturn(Mono.empty());

            // When
            router.route("s1", GatewayEnvelope.of("new_chat", null, "s1")).block();

            // Then
            verify(orchestrator).clearSessionContext("s1");
            verify(gateway).sendMessage("s1", "chat_reset", Map.of("message", "New chat started."));
        }

        @Test
        @DisplayName("should report a failed reset")
        void newChatFailure() {
            when(sessionManager.resetSessionContext("s1")).thenReturn(Mono.just(false));
            when(orchestrator.clearSessionContext("s1")).thenReturn(Mono.empty());

            router.route("s1", GatewayEnvelope.of("new_chat", null, "s1")).block();

            verify(gateway).sendError("s1", "Failed to start new chat.");
        }

        @Test
        @DisplayName("should reset silently without replying")
        void newChatSilent() {
            when(sessionManager.resetSessionContext("s1")).thenReturn(Mono.just(true));
            when(orchestrator.clearSessionContext("s1")).thenReturn(Mono.empty());

            StepVerifier.create(router.route("s1", GatewayEnvelope.of("new_chat_silent", null, "s1")))
                    .expectNext(true)
                    .verifyComplete();

            verify(gateway, never()).sendMessage(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("should request ads with the frame's context keys")
        void adsRequest() {
            when(orchestrator.isRunning()).thenReturn(true);
            when(orchestrator.requestAds("s1", List.of("shoes", "hats"))).thenReturn(Mono.just(true));

            StepVerifier.create(router.route("s1", GatewayEnvelope.of("ads_request",
                            Map.of("context_keys", List.of("shoes", "hats")), "s1")))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should accept a single context key as plain content")
        void adsRequestWithSingleKey() {
            when(orchestrator.isRunning()).thenReturn(true);
            when(orchestrator.requestAds("s1", List.of("kitchen"))).thenReturn(Mono.just(true));

            router.route("s1", GatewayEnvelope.of("ads_request", "kitchen", "s1")).block();

            verify(orchestrator).requestAds("s1", List.of("kitchen"));
        }
    }
}
