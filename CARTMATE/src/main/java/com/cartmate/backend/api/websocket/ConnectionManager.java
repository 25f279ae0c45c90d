package com.cartmate.backend.api.websocket;

import com.cartmate.backend.a2a.A2aMessageBus;
import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.domain.model.ChatSession;
import com.cartmate.backend.domain.model.FrontendNotification;
import com.cartmate.backend.exception.TransportException;
import com.cartmate.backend.storage.SessionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks live chat and backchannel connections by session and by user.
 *
 * <p>A failed write to a connection is treated as a disconnect: the session is removed from every
 * index and the failure is reported as {@code false}, never as an error.
 */
@Service
@Slf4j
public class ConnectionManager {

    private static final String BACKCHANNEL_SUBSCRIBER_PREFIX = "backchannel:";

    private final Map<String, ConnectionInfo> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userSessions = new ConcurrentHashMap<>();
    private final Set<String> backchannelSessions = ConcurrentHashMap.newKeySet();
    private final Map<String, Deque<GatewayEnvelope>> queuedMessages = new ConcurrentHashMap<>();

    private final SessionManager sessionManager;
    private final A2aMessageBus messageBus;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxQueuedMessages;

    public ConnectionManager(SessionManager sessionManager, A2aMessageBus messageBus,
                             ObjectMapper objectMapper, Clock clock, CartmateProperties properties) {
        this.sessionManager = sessionManager;
        this.messageBus = messageBus;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxQueuedMessages = properties.getGateway().getMaxQueuedMessagesPerSession();
    }

    // --------------------------------------------------------------------------------------------
    // Connect / disconnect
    // --------------------------------------------------------------------------------------------

    /**
     * Binds a chat connection to a session, resuming the stored session when it exists.
     * Sends {@code connection_established} followed by any messages queued while offline.
     *
     * @return the session id in use
     */
    public Mono<String> connect(ClientConnection connection, String sessionId, String userId) {
        return open(connection, sessionId, userId, false);
    }

    /**
     * Binds a backchannel connection. Frontend notifications on the bus are mirrored to it as
     * {@code a2a_message} frames until it disconnects.
     */
    public Mono<String> connectBackchannel(ClientConnection connection, String sessionId, String userId) {
        return open(connection, sessionId, userId, true);
    }

    public Mono<Void> disconnect(String sessionId) {
        return Mono.defer(() -> {
            ConnectionInfo info = unregister(sessionId);
            if (info == null) {
                return Mono.empty();
            }
            return info.getConnection().close()
                    .onErrorResume(e -> {
                        log.debug("Error closing connection for session {}: {}", sessionId, e.getMessage());
                        return Mono.empty();
                    });
        });
    }

    /**
     * Drops the session only while it is still bound to the given connection, so a closing
     * connection cannot remove the one that replaced it.
     */
    public Mono<Void> release(String sessionId, ClientConnection connection) {
        return Mono.fromRunnable(() -> {
            ConnectionInfo info = connections.get(sessionId);
            if (info != null && info.getConnection() == connection) {
                unregister(sessionId);
            }
        });
    }

    // --------------------------------------------------------------------------------------------
    // Sending
    // --------------------------------------------------------------------------------------------

    /**
     * @return true when the frame was written; false when the session is not live or the write
     * failed, in which case the session is disconnected
     */
    public Mono<Boolean> send(String sessionId, GatewayEnvelope envelope) {
        return Mono.defer(() -> {
            ConnectionInfo info = connections.get(sessionId);
            if (info == null) {
                log.debug("No active connection for session {}, dropping {} frame", sessionId, envelope.getType());
                return Mono.just(false);
            }
            if (envelope.getSessionId() == null) {
                envelope.setSessionId(sessionId);
            }
            String json;
            try {
                json = objectMapper.writeValueAsString(envelope);
            } catch (JsonProcessingException e) {
                log.error("Could not serialize {} frame for session {}: {}", envelope.getType(), sessionId,
                        e.getMessage());
                return Mono.just(false);
            }
            return info.getConnection().send(json)
                    .then(Mono.fromSupplier(() -> {
                        info.setLastActivity(clock.instant());
                        return true;
                    }))
                    .onErrorResume(e -> {
                        log.error("Error sending to session {}: {}", sessionId, e.getMessage());
                        return disconnect(sessionId).thenReturn(false);
                    });
        });
    }

    /**
     * @return number of the user's sessions that received the frame
     */
    public Mono<Integer> sendToUser(String userId, GatewayEnvelope envelope) {
        Set<String> sessions = userSessions.get(userId);
        if (sessions == null || sessions.isEmpty()) {
            return Mono.just(0);
        }
        return countDelivered(Flux.fromIterable(List.copyOf(sessions)), envelope);
    }

    /**
     * Sends to every live session except those excluded.
     */
    public Mono<Integer> broadcast(GatewayEnvelope envelope, Set<String> exclude) {
        return countDelivered(Flux.fromIterable(List.copyOf(connections.keySet()))
                .filter(id -> exclude == null || !exclude.contains(id)), envelope);
    }

    public Mono<Integer> broadcastToBackchannel(GatewayEnvelope envelope, Set<String> exclude) {
        return countDelivered(Flux.fromIterable(List.copyOf(backchannelSessions))
                .filter(id -> exclude == null || !exclude.contains(id)), envelope);
    }

    /**
     * Sends immediately when the session is live, otherwise holds the frame until it reconnects.
     * The oldest queued frame is dropped once the per-session queue is full.
     */
    public Mono<Boolean> queueMessage(String sessionId, GatewayEnvelope envelope) {
        if (isSessionActive(sessionId)) {
            return send(sessionId, envelope);
        }
        return Mono.fromSupplier(() -> {
            if (maxQueuedMessages == 0) {
                return false;
            }
            Deque<GatewayEnvelope> queue = queuedMessages.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
            synchronized (queue) {
                if (queue.size() >= maxQueuedMessages) {
                    GatewayEnvelope dropped = queue.pollFirst();
                    log.warn("Queue for session {} is full, dropping {} frame", sessionId,
                            dropped != null ? dropped.getType() : null);
                }
                queue.addLast(envelope);
            }
            log.debug("Queued {} frame for offline session {}", envelope.getType(), sessionId);
            return true;
        });
    }

    // --------------------------------------------------------------------------------------------
    // Queries
    // --------------------------------------------------------------------------------------------

    public boolean isSessionActive(String sessionId) {
        return connections.containsKey(sessionId);
    }

    public boolean isBackchannel(String sessionId) {
        return backchannelSessions.contains(sessionId);
    }

    public Set<String> getActiveSessions() {
        return Set.copyOf(connections.keySet());
    }

    public Set<String> getBackchannelSessions() {
        return Set.copyOf(backchannelSessions);
    }

    public Set<String> getUserSessions(String userId) {
        Set<String> sessions = userSessions.get(userId);
        return sessions != null ? Set.copyOf(sessions) : Set.of();
    }

    public int queuedMessageCount(String sessionId) {
        Deque<GatewayEnvelope> queue = queuedMessages.get(sessionId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.size();
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("active_connections", connections.size());
        stats.put("backchannel_connections", backchannelSessions.size());
        stats.put("unique_users", userSessions.size());
        stats.put("queued_sessions", queuedMessages.size());
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<String> open(ClientConnection connection, String requestedSessionId, String requestedUserId,
                              boolean backchannel) {
        String sessionId = requestedSessionId != null && !requestedSessionId.isBlank()
                ? requestedSessionId
                : UUID.randomUUID().toString();
        String fallbackUserId = requestedUserId != null && !requestedUserId.isBlank()
                ? requestedUserId
                : (backchannel ? "backchannel_" : "anonymous_") + UUID.randomUUID().toString().substring(0, 8);

        return sessionManager.getSession(sessionId)
                .switchIfEmpty(Mono.defer(() -> sessionManager.createSession(fallbackUserId, sessionId)))
                .flatMap(session -> {
                    register(connection, session, backchannel);
                    Map<String, Object> content = new LinkedHashMap<>();
                    content.put("session_id", sessionId);
                    content.put("user_id", session.getUserId());
                    content.put("message", backchannel
                            ? "Backchannel connected for agent communication"
                            : "Connected to CartMate");
                    String type = backchannel ? "backchannel_connected" : "connection_established";
                    return send(sessionId, GatewayEnvelope.of(type, content, sessionId))
                            .then(flushQueued(sessionId))
                            .thenReturn(sessionId);
                });
    }

    private void register(ClientConnection connection, ChatSession session, boolean backchannel) {
        String sessionId = session.getId();
        Instant now = clock.instant();
        ConnectionInfo previous = connections.put(sessionId, ConnectionInfo.builder()
                .connection(connection)
                .sessionId(sessionId)
                .userId(session.getUserId())
                .backchannel(backchannel)
                .connectedAt(now)
                .lastActivity(now)
                .build());
        if (previous != null) {
            // the rebind may change the user or the channel kind
            dropIndices(sessionId, previous);
            if (previous.getConnection() != connection) {
                log.info("Session {} reconnected, replacing connection {}", sessionId,
                        previous.getConnection().getId());
                previous.getConnection().close().subscribe(
                        ignored -> { },
                        e -> log.debug("Error closing replaced connection: {}", e.getMessage()));
            }
        }
        userSessions.computeIfAbsent(session.getUserId(), id -> ConcurrentHashMap.newKeySet()).add(sessionId);

        if (backchannel) {
            backchannelSessions.add(sessionId);
            messageBus.addFrontendSubscriber(BACKCHANNEL_SUBSCRIBER_PREFIX + sessionId,
                    notification -> mirrorToBackchannel(sessionId, notification));
        }
        log.info("{} connected: session {} user {}", backchannel ? "Backchannel" : "Client", sessionId,
                session.getUserId());
    }

    private ConnectionInfo unregister(String sessionId) {
        ConnectionInfo info = connections.remove(sessionId);
        if (info == null) {
            return null;
        }
        dropIndices(sessionId, info);
        log.info("Disconnected session {} (user {})", sessionId, info.getUserId());
        return info;
    }

    private void dropIndices(String sessionId, ConnectionInfo info) {
        userSessions.computeIfPresent(info.getUserId(), (user, sessions) -> {
            sessions.remove(sessionId);
            return sessions.isEmpty() ? null : sessions;
        });
        if (backchannelSessions.remove(sessionId)) {
            messageBus.removeFrontendSubscriber(BACKCHANNEL_SUBSCRIBER_PREFIX + sessionId);
        }
    }

    private void mirrorToBackchannel(String sessionId, FrontendNotification notification) {
        if (!isSessionActive(sessionId)) {
            // the bus drops a subscriber that throws
            throw new TransportException("Backchannel session " + sessionId + " is gone");
        }
        send(sessionId, GatewayEnvelope.of("a2a_message", notification.toPayload(), sessionId)).subscribe(
                ignored -> { },
                e -> log.error("Failed to mirror notification to backchannel {}: {}", sessionId, e.getMessage()));
    }

    private Mono<Void> flushQueued(String sessionId) {
        Deque<GatewayEnvelope> queue = queuedMessages.remove(sessionId);
        if (queue == null) {
            return Mono.empty();
        }
        List<GatewayEnvelope> pending;
        synchronized (queue) {
            pending = List.copyOf(queue);
        }
        log.info("Delivering {} queued frames to session {}", pending.size(), sessionId);
        return Flux.fromIterable(pending)
                .concatMap(envelope -> send(sessionId, envelope))
                .then();
    }

    private Mono<Integer> countDelivered(Flux<String> sessionIds, GatewayEnvelope envelope) {
        return sessionIds
                .concatMap(id -> send(id, copyFor(envelope, id)))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
    }

    private GatewayEnvelope copyFor(GatewayEnvelope envelope, String sessionId) {
        return GatewayEnvelope.builder()
                .type(envelope.getType())
                .content(envelope.getContent())
                .sessionId(envelope.getSessionId() != null ? envelope.getSessionId() : sessionId)
                .timestamp(envelope.getTimestamp())
                .build();
    }
}
