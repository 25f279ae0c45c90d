package com.cartmate.backend.api.websocket;

import com.cartmate.backend.domain.model.FrontendNotification;
import com.cartmate.backend.support.A2aTestHarness;
import com.cartmate.backend.support.RecordingConnection;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConnectionManager}.
 */
class ConnectionManagerTest {

    private A2aTestHarness harness;
    private ConnectionManager connectionManager;

    @BeforeEach
    void setUp() {
        harness = new A2aTestHarness();
        connectionManager = harness.connectionManager;
    }

    @AfterEach
    void tearDown() {
        harness.dispose();
    }

    @Nested
    @DisplayName("Connecting")
    class ConnectingTests {

        @Test
        @DisplayName("should create a session and greet the client")
        void createsSessionOnConnect() {
            // Given
            RecordingConnection connection = new RecordingConnection();

            // When
            StepVerifier.create(connectionManager.connect(connection, "s1", "user-1"))
                    .expectNext("s1")
                    .verifyComplete();

            // Then
            assertThat(connectionManager.isSessionActive("s1")).isTrue();
            assertThat(connectionManager.getUserSessions("user-1")).containsExactly("s1");
            JsonNode greeting = connection.parsedFrames().get(0);
            assertThat(greeting.path("type").asText()).isEqualTo("connection_established");
            assertThat(greeting.path("session_id").asText()).isEqualTo("s1");
            assertThat(greeting.path("content").path("user_id").asText()).isEqualTo("user-1");
            StepVerifier.create(harness.sessionManager.getSession("s1")).expectNextCount(1).verifyComplete();
        }

        @Test
        @DisplayName("should generate ids for anonymous clients")
        void generatesIds() {
            RecordingConnection connection = new RecordingConnection();

            String sessionId = connectionManager.connect(connection, null, null).block();

            assertThat(sessionId).isNotBlank();
            JsonNode greeting = connection.parsedFrames().get(0);
            assertThat(greeting.path("content").path("user_id").asText()).startsWith("anonymous_");
        }

        @Test
        @DisplayName("should resume a stored session with its original user")
        void resumesSession() {
            harness.sessionManager.createSession("user-1", "s1").block();
            RecordingConnection connection = new RecordingConnection();

            connectionManager.connect(connection, "s1", "someone-else").block();

            assertThat(connectionManager.getUserSessions("user-1")).containsExactly("s1");
        }

        @Test
        @DisplayName("should close the previous connection when a session reconnects")
        void replacesPreviousConnection() {
            // Given
            RecordingConnection first = new RecordingConnection();
            RecordingConnection second = new RecordingConnection();
            connectionManager.connect(first, "s1", "user-1").block();

            // When
            connectionManager.connect(second, "s1", "user-1").block();
            connectionManager.release("s1", first).block();

            // Then
            assertThat(first.isOpen()).isFalse();
            assertThat(connectionManager.isSessionActive("s1")).isTrue();
            StepVerifier.create(connectionManager.send("s1", GatewayEnvelope.text("hi", null)))
                    .expectNext(true)
                    .verifyComplete();
            assertThat(second.frameTypes()).containsExactly("connection_established", "text");
        }
    }

    @Nested
    @DisplayName("Sending")
    class SendingTests {

        @Test
        @DisplayName("should report false for an unknown session")
        void unknownSession() {
            StepVerifier.create(connectionManager.send("missing", GatewayEnvelope.text("hi", null)))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should disconnect a session whose write fails")
        void failedWriteDisconnects() {
            // Given
            RecordingConnection connection = new RecordingConnection();
            connectionManager.connect(connection, "s1", "user-1").block();
            connection.failWrites();

            // When
            StepVerifier.create(connectionManager.send("s1", GatewayEnvelope.text("hi", null)))
                    .expectNext(false)
                    .verifyComplete();

            // Then
            assertThat(connectionManager.isSessionActive("s1")).isFalse();
            assertThat(connectionManager.getUserSessions("user-1")).isEmpty();
        }

        @Test
        @DisplayName("should count the sessions of a user that received a frame")
        void sendToUserCounts() {
            // Given
            RecordingConnection laptop = new RecordingConnection();
            RecordingConnection phone = new RecordingConnection();
            RecordingConnection broken = new RecordingConnection();
            connectionManager.connect(laptop, "s1", "user-1").block();
            connectionManager.connect(phone, "s2", "user-1").block();
            connectionManager.connect(broken, "s3", "user-1").block();
            broken.failWrites();

            // When / Then
            StepVerifier.create(connectionManager.sendToUser("user-1", GatewayEnvelope.text("sale!", null)))
                    .expectNext(2)
                    .verifyComplete();
            assertThat(connectionManager.getUserSessions("user-1")).containsExactlyInAnyOrder("s1", "s2");
            assertThat(laptop.framesOfType("text").get(0).path("session_id").asText()).isEqualTo("s1");
            assertThat(phone.framesOfType("text").get(0).path("session_id").asText()).isEqualTo("s2");
        }

        @Test
        @DisplayName("should broadcast to every session except the excluded ones")
        void broadcastExcludes() {
            RecordingConnection first = new RecordingConnection();
            RecordingConnection second = new RecordingConnection();
            connectionManager.connect(first, "s1", "user-1").block();
            connectionManager.connect(second, "s2", "user-2").block();

            StepVerifier.create(connectionManager.broadcast(
                            GatewayEnvelope.of("system", Map.of("message", "maintenance"), null), Set.of("s2")))
                    .expectNext(1)
                    .verifyComplete();

            assertThat(first.frameTypes()).contains("system");
            assertThat(second.frameTypes()).doesNotContain("system");
        }
    }

    @Nested
    @DisplayName("Offline queue")
    class OfflineQueueTests {

        @Test
        @DisplayName("should hold frames for an offline session and deliver them on reconnect")
        void flushesOnReconnect() {
            // Given
            StepVerifier.create(connectionManager.queueMessage("s1", GatewayEnvelope.text("while away", "s1")))
                    .expectNext(true)
                    .verifyComplete();
            assertThat(connectionManager.queuedMessageCount("s1")).isEqualTo(1);

            // When
            RecordingConnection connection = new RecordingConnection();
            connectionManager.connect(connection, "s1", "user-1").block();

            // Then
            assertThat(connection.frameTypes()).containsExactly("connection_established", "text");
            assertThat(connectionManager.queuedMessageCount("s1")).isZero();
        }

        @Test
        @DisplayName("should drop the oldest frame once the queue is full")
        void boundedQueue() {
            for (int i = 0; i < 55; i++) {
                connectionManager.queueMessage("s1", GatewayEnvelope.text("m" + i, "s1")).block();
            }

            assertThat(connectionManager.queuedMessageCount("s1")).isEqualTo(50);

            RecordingConnection connection = new RecordingConnection();
            connectionManager.connect(connection, "s1", "user-1").block();
            assertThat(connection.framesOfType("text").get(0).path("content").asText()).isEqualTo("m5");
        }

        @Test
        @DisplayName("should send directly when the session is live")
        void sendsWhenLive() {
            RecordingConnection connection = new RecordingConnection();
            connectionManager.connect(connection, "s1", "user-1").block();

            connectionManager.queueMessage("s1", GatewayEnvelope.text("now", "s1")).block();

            assertThat(connection.frameTypes()).containsExactly("connection_established", "text");
            assertThat(connectionManager.queuedMessageCount("s1")).isZero();
        }
    }

    @Nested
    @DisplayName("Backchannel")
    class BackchannelTests {

        @Test
        @DisplayName("should mirror frontend notifications to backchannel sessions only")
        void mirrorsNotifications() {
            // Given
            RecordingConnection chat = new RecordingConnection();
            RecordingConnection backchannel = new RecordingConnection();
            connectionManager.connect(chat, "chat-1", "user-1").block();
            connectionManager.connectBackchannel(backchannel, "bc-1", null).block();
            harness.messageBus.listen("orchestrator_001");

            // When
            harness.messageBus.sendDirect("orchestrator_001", FrontendNotification.builder()
                    .sender("cart_management_001")
                    .receiver("orchestrator_001")
                    .notificationType(FrontendNotification.NotificationType.AGENT_ACTION)
                    .agentName("Cart Management Agent")
                    .agentId("cart_management_001")
                    .content("Cart has 2 item(s)")
                    .build()).block();

            // Then
            assertThat(connectionManager.isBackchannel("bc-1")).isTrue();
            assertThat(backchannel.frameTypes()).containsExactly("backchannel_connected", "a2a_message");
            JsonNode mirrored = backchannel.framesOfType("a2a_message").get(0).path("content");
            assertThat(mirrored.path("notification_type").asText()).isEqualTo("agent_action");
            assertThat(mirrored.path("content").asText()).isEqualTo("Cart has 2 item(s)");
            assertThat(chat.frameTypes()).containsExactly("connection_established");
        }

        @Test
        @DisplayName("should stop mirroring when a backchannel session rebinds as chat")
        void rebindAsChatDropsBackchannel() {
            // Given
            RecordingConnection backchannel = new RecordingConnection();
            RecordingConnection chat = new RecordingConnection();
            connectionManager.connectBackchannel(backchannel, "s1", "user-1").block();
            harness.messageBus.listen("orchestrator_001");

            // When
            connectionManager.connect(chat, "s1", "user-1").block();
            harness.messageBus.sendDirect("orchestrator_001", FrontendNotification.builder()
                    .sender("cart_management_001")
                    .receiver("orchestrator_001")
                    .notificationType(FrontendNotification.NotificationType.AGENT_ACTION)
                    .agentName("Cart Management Agent")
                    .agentId("cart_management_001")
                    .content("Cart has 2 item(s)")
                    .build()).block();

            // Then
            assertThat(connectionManager.isBackchannel("s1")).isFalse();
            assertThat(harness.messageBus.frontendSubscriberCount()).isZero();
            assertThat(chat.frameTypes()).containsExactly("connection_established");
            assertThat(connectionManager.getStats()).containsEntry("backchannel_connections", 0);
        }

        @Test
        @DisplayName("should move a rebound session to its new user")
        void rebindMovesUser() {
            connectionManager.connect(new RecordingConnection(), "s1", "user-1").block();
            harness.sessionManager.deleteSession("s1").block();

            connectionManager.connect(new RecordingConnection(), "s1", "user-2").block();

            assertThat(connectionManager.getUserSessions("user-1")).isEmpty();
            assertThat(connectionManager.getUserSessions("user-2")).containsExactly("s1");
            assertThat(connectionManager.getStats()).containsEntry("unique_users", 1);
        }

        @Test
        @DisplayName("should stop mirroring once the backchannel disconnects")
        void unsubscribesOnDisconnect() {
            RecordingConnection backchannel = new RecordingConnection();
            connectionManager.connectBackchannel(backchannel, "bc-1", null).block();
            assertThat(harness.messageBus.frontendSubscriberCount()).isEqualTo(1);

            connectionManager.disconnect("bc-1").block();

            assertThat(harness.messageBus.frontendSubscriberCount()).isZero();
            assertThat(backchannel.isOpen()).isFalse();
            assertThat(connectionManager.getBackchannelSessions()).isEmpty();
        }
    }
}
