package com.cartmate.backend.api.websocket.error;

import com.cartmate.backend.api.websocket.ConnectionManager;
import com.cartmate.backend.api.websocket.GatewayEnvelope;
import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.observability.A2aEventLogger;
import com.cartmate.backend.observability.A2aMetrics;
import com.cartmate.backend.storage.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Client-facing error handling for gateway sessions: error history, per-session rate limiting
 * and bounded reconnection with exponential backoff.
 */
@Service
@Slf4j
public class ConnectionErrorHandler {

    /**
     * Reaction to an error code, run after the error was recorded and forwarded to the client.
     */
    @FunctionalInterface
    public interface Handler {
        Mono<Void> handle(GatewayError error);
    }

    private final Map<String, Deque<GatewayError>> errorHistory = new ConcurrentHashMap<>();
    private final Map<String, Deque<Instant>> rateLimits = new ConcurrentHashMap<>();
    private final Map<String, ConnectionState> connectionStates = new ConcurrentHashMap<>();
    private final Map<String, Integer> reconnectionAttempts = new ConcurrentHashMap<>();
    private final Map<String, Disposable> reconnectionTimers = new ConcurrentHashMap<>();
    private final Map<ErrorCode, Handler> handlers = new EnumMap<>(ErrorCode.class);

    private final ConnectionManager connectionManager;
    private final SessionManager sessionManager;
    private final A2aMetrics metrics;
    private final A2aEventLogger eventLogger;
    private final Scheduler scheduler;
    private final Clock clock;
    private final CartmateProperties.ErrorProperties config;

    public ConnectionErrorHandler(ConnectionManager connectionManager,
                                  SessionManager sessionManager,
                                  A2aMetrics metrics,
                                  A2aEventLogger eventLogger,
                                  @Qualifier("a2aScheduler") Scheduler scheduler,
                                  Clock clock,
                                  CartmateProperties properties) {
        this.connectionManager = connectionManager;
        this.sessionManager = sessionManager;
        this.metrics = metrics;
        this.eventLogger = eventLogger;
        this.scheduler = scheduler;
        this.clock = clock;
        this.config = properties.getErrors();
        registerDefaultHandlers();
    }

    // --------------------------------------------------------------------------------------------
    // Errors
    // --------------------------------------------------------------------------------------------

    /**
     * Records the error, forwards it to the client when its session is live and runs the
     * handler registered for its code.
     *
     * @return false when handling itself failed
     */
    public Mono<Boolean> handleError(GatewayError error) {
        return Mono.defer(() -> {
            if (error.getTimestamp() == null) {
                error.setTimestamp(clock.instant());
            }
            String sessionId = error.getSessionId();
            metrics.getGatewayErrors().increment();
            logError(error);
            eventLogger.logGatewayError(sessionId, error.getCode().getValue(),
                    error.getSeverity().getValue(), error.getMessage());

            if (sessionId == null) {
                return dispatch(error).thenReturn(true);
            }
            addToHistory(sessionId, error);

            Mono<Boolean> notify = connectionManager.isSessionActive(sessionId)
                    ? connectionManager.send(sessionId, GatewayEnvelope.of("error", error.toPayload(), sessionId))
                    : Mono.just(false);
            return notify.then(dispatch(error)).thenReturn(true);
        }).onErrorResume(e -> {
            log.error("Error while handling {} for session {}: {}", error.getCode(), error.getSessionId(),
                    e.getMessage(), e);
            return Mono.just(false);
        });
    }

    public void registerHandler(ErrorCode code, Handler handler) {
        synchronized (handlers) {
            handlers.put(code, handler);
        }
    }

    public List<GatewayError> getErrorHistory(String sessionId) {
        Deque<GatewayError> history = errorHistory.get(sessionId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    // --------------------------------------------------------------------------------------------
    // Rate limiting
    // --------------------------------------------------------------------------------------------

    /**
     * Admits a client message when fewer than {@code rateLimitMaxMessages} were admitted in the
     * trailing window. A rejection raises {@link ErrorCode#RATE_LIMIT_EXCEEDED} with
     * {@code retry_after} set to the window length.
     */
    public Mono<Boolean> checkRateLimit(String sessionId) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Instant cutoff = now.minus(config.getRateLimitWindow());
            Deque<Instant> timestamps = rateLimits.computeIfAbsent(sessionId, id -> new ArrayDeque<>());

            boolean admitted;
            synchronized (timestamps) {
                while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
                    timestamps.pollFirst();
                }
                admitted = timestamps.size() < config.getRateLimitMaxMessages();
                if (admitted) {
                    timestamps.addLast(now);
                }
            }
            if (admitted) {
                return Mono.just(true);
            }

            metrics.getRateLimited().increment();
            GatewayError error = GatewayError.of(ErrorCode.RATE_LIMIT_EXCEEDED, sessionId,
                    "Rate limit exceeded. Please slow down.", now);
            error.setRetryAfter((int) config.getRateLimitWindow().getSeconds());
            error.setDetails(Map.of(
                    "limit", config.getRateLimitMaxMessages(),
                    "window_seconds", config.getRateLimitWindow().getSeconds()));
            return handleError(error).thenReturn(false);
        });
    }

    // --------------------------------------------------------------------------------------------
    // Reconnection
    // --------------------------------------------------------------------------------------------

    /**
     * Schedules a reconnection attempt after {@code min(initialDelay * multiplier^attempts, maxDelay)}.
     * Does nothing while the session is connected or already reconnecting. Once
     * {@code maxAttempts} attempts were made the session is marked {@link ConnectionState#FAILED}.
     *
     * @return true when an attempt was scheduled
     */
    public Mono<Boolean> initiateReconnection(String sessionId) {
        return Mono.fromSupplier(() -> {
            ConnectionState current = getConnectionState(sessionId);
            if (current == ConnectionState.CONNECTED || current == ConnectionState.RECONNECTING) {
                log.debug("Session {} is {}, not reconnecting", sessionId, current);
                return false;
            }

            CartmateProperties.ErrorProperties.ReconnectionProperties reconnection = config.getReconnection();
            int attempts = reconnectionAttempts.getOrDefault(sessionId, 0);
            if (attempts >= reconnection.getMaxAttempts()) {
                log.warn("Max reconnection attempts reached for session {}", sessionId);
                setConnectionState(sessionId, ConnectionState.FAILED);
                eventLogger.logReconnection(sessionId, "exhausted", attempts, 0);
                return false;
            }

            setConnectionState(sessionId, ConnectionState.RECONNECTING);
            int attempt = attempts + 1;
            reconnectionAttempts.put(sessionId, attempt);
            Duration delay = reconnectionDelay(attempts);

            log.info("Initiating reconnection for session {} in {} ms (attempt {})",
                    sessionId, delay.toMillis(), attempt);
            metrics.getReconnectionsScheduled().increment();
            eventLogger.logReconnection(sessionId, "scheduled", attempt, delay.toMillis());

            Disposable timer = Mono.delay(delay, scheduler)
                    .then(Mono.defer(() -> performReconnection(sessionId)))
                    .subscribe(
                            ignored -> { },
                            e -> log.error("Reconnection of session {} failed: {}", sessionId, e.getMessage()));
            Disposable previous = reconnectionTimers.put(sessionId, timer);
            if (previous != null) {
                previous.dispose();
            }
            return true;
        });
    }

    /**
     * Marks the session as connected again, clearing its attempt counter and any pending attempt.
     */
    public void resetReconnectionAttempts(String sessionId) {
        cancelReconnection(sessionId);
        setConnectionState(sessionId, ConnectionState.CONNECTED);
    }

    public int getReconnectionAttempts(String sessionId) {
        return reconnectionAttempts.getOrDefault(sessionId, 0);
    }

    public boolean hasScheduledReconnection(String sessionId) {
        Disposable timer = reconnectionTimers.get(sessionId);
        return timer != null && !timer.isDisposed();
    }

    // --------------------------------------------------------------------------------------------
    // Connection state
    // --------------------------------------------------------------------------------------------

    public void setConnectionState(String sessionId, ConnectionState state) {
        ConnectionState previous = connectionStates.put(sessionId, state);
        if (previous != state) {
            log.debug("Session {} connection state {} -> {}", sessionId, previous, state);
        }
    }

    public ConnectionState getConnectionState(String sessionId) {
        return connectionStates.getOrDefault(sessionId, ConnectionState.DISCONNECTED);
    }

    /**
     * Forgets everything tracked for a session and cancels a scheduled reconnection.
     */
    public void cleanupSession(String sessionId) {
        errorHistory.remove(sessionId);
        rateLimits.remove(sessionId);
        connectionStates.remove(sessionId);
        cancelReconnection(sessionId);
        log.debug("Cleaned up error tracking for session {}", sessionId);
    }

    public Map<String, Object> getErrorStats() {
        int total = 0;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Deque<GatewayError> history : errorHistory.values()) {
            synchronized (history) {
                total += history.size();
                for (GatewayError error : history) {
                    counts.merge(error.getCode().getValue(), 1, Integer::sum);
                }
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_errors", total);
        stats.put("error_counts", counts);
        stats.put("active_sessions", connectionStates.size());
        stats.put("reconnecting_sessions", countInState(ConnectionState.RECONNECTING));
        stats.put("failed_sessions", countInState(ConnectionState.FAILED));
        stats.put("timestamp", clock.instant().toString());
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private void registerDefaultHandlers() {
        handlers.put(ErrorCode.CONNECTION_FAILED, error -> error.getSessionId() == null
                ? Mono.empty()
                : initiateReconnection(error.getSessionId()).then());
        handlers.put(ErrorCode.SESSION_EXPIRED, error -> error.getSessionId() == null
                ? Mono.empty()
                : sessionManager.deleteSession(error.getSessionId())
                        .then(Mono.fromRunnable(() -> cleanupSession(error.getSessionId()))));
        handlers.put(ErrorCode.RATE_LIMIT_EXCEEDED, error -> Mono.empty());
        handlers.put(ErrorCode.INTERNAL_ERROR, error -> Mono.fromRunnable(() ->
                log.error("Internal gateway error for session {}: {}", error.getSessionId(), error.getMessage())));
        handlers.put(ErrorCode.SERVICE_UNAVAILABLE, error -> error.getSessionId() == null
                ? Mono.empty()
                : connectionManager.queueMessage(error.getSessionId(), GatewayEnvelope.of("service_status",
                        Map.of("status", "unavailable",
                                "message", "Service temporarily unavailable, will retry automatically"),
                        error.getSessionId())).then());
    }

    private void cancelReconnection(String sessionId) {
        reconnectionAttempts.remove(sessionId);
        Disposable timer = reconnectionTimers.remove(sessionId);
        if (timer != null) {
            timer.dispose();
        }
    }

    private Mono<Void> dispatch(GatewayError error) {
        Handler handler;
        synchronized (handlers) {
            handler = handlers.get(error.getCode());
        }
        if (handler == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> handler.handle(error));
    }

    private Mono<Boolean> performReconnection(String sessionId) {
        if (getConnectionState(sessionId) != ConnectionState.RECONNECTING) {
            return Mono.just(false);
        }
        int attempt = getReconnectionAttempts(sessionId);
        return sessionManager.extendSession(sessionId)
                .flatMap(extended -> {
                    if (!extended) {
                        log.warn("Session {} not found during reconnection", sessionId);
                        setConnectionState(sessionId, ConnectionState.FAILED);
                        eventLogger.logReconnection(sessionId, "session_missing", attempt, 0);
                        return Mono.just(false);
                    }
                    Map<String, Object> content = new LinkedHashMap<>();
                    content.put("session_id", sessionId);
                    content.put("message", "Ready for reconnection");
                    content.put("attempt", attempt);
                    log.info("Reconnection ready for session {}", sessionId);
                    eventLogger.logReconnection(sessionId, "ready", attempt, 0);
                    return connectionManager.queueMessage(sessionId,
                            GatewayEnvelope.of("reconnection_ready", content, sessionId));
                })
                .onErrorResume(e -> {
                    log.error("Error performing reconnection for session {}: {}", sessionId, e.getMessage());
                    setConnectionState(sessionId, ConnectionState.FAILED);
                    return Mono.just(false);
                });
    }

    private Duration reconnectionDelay(int previousAttempts) {
        CartmateProperties.ErrorProperties.ReconnectionProperties reconnection = config.getReconnection();
        double millis = reconnection.getInitialDelay().toMillis()
                * Math.pow(reconnection.getBackoffMultiplier(), previousAttempts);
        millis = Math.min(millis, reconnection.getMaxDelay().toMillis());
        if (reconnection.isJitter()) {
            millis *= 0.5 + ThreadLocalRandom.current().nextDouble() * 0.5;
        }
        return Duration.ofMillis((long) millis);
    }

    private void addToHistory(String sessionId, GatewayError error) {
        Deque<GatewayError> history = errorHistory.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(error);
            while (history.size() > config.getMaxErrorHistory()) {
                history.pollFirst();
            }
        }
    }

    private long countInState(ConnectionState state) {
        return connectionStates.values().stream().filter(s -> s == state).count();
    }

    private void logError(GatewayError error) {
        switch (error.getSeverity()) {
            case CRITICAL -> log.error("Critical gateway error {} for session {}: {}",
                    error.getCode(), error.getSessionId(), error.getMessage());
            case HIGH -> log.error("Gateway error {} for session {}: {}",
                    error.getCode(), error.getSessionId(), error.getMessage());
            case MEDIUM -> log.warn("Gateway error {} for session {}: {}",
                    error.getCode(), error.getSessionId(), error.getMessage());
            default -> log.info("Gateway error {} for session {}: {}",
                    error.getCode(), error.getSessionId(), error.getMessage());
        }
    }
}
