package com.cartmate.backend.agent;

import com.cartmate.backend.a2a.A2aMessageBus;
import com.cartmate.backend.a2a.AgentCoordinator;
import com.cartmate.backend.a2a.DirectChannel;
import com.cartmate.backend.domain.model.A2aAcknowledgment;
import com.cartmate.backend.domain.model.A2aEvent;
import com.cartmate.backend.domain.model.A2aMessage;
import com.cartmate.backend.domain.model.A2aMessageType;
import com.cartmate.backend.domain.model.A2aMessageVisitor;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.A2aResponse;
import com.cartmate.backend.domain.model.AgentRegistration;
import com.cartmate.backend.domain.model.FrontendNotification;
import com.cartmate.backend.domain.model.RequestType;
import com.cartmate.backend.domain.model.payload.RequestPayload;
import com.cartmate.backend.exception.DeliveryException;
import com.cartmate.backend.exception.InvalidMessageException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for agents on the A2A bus.
 *
 * <p>An agent consumes its direct channel one message at a time on the shared agent scheduler.
 * Messages that require acknowledgment are acknowledged before they reach a handler.
 *
 * <p>Outbound delivery has two independent retry layers:
 * <ul>
 *   <li>transport: a bus failure is retried up to {@code maxRetries} times with exponential
 *       backoff ({@code retryBackoffBase * 2^n});</li>
 *   <li>acknowledgment: after a successful hand-off of an ack-requiring message a timeout is armed;
 *       when it fires the same message is resent, up to {@code maxRetries} times, after which the
 *       failure is surfaced through {@link #handleDeliveryFailure(A2aMessage)}.</li>
 * </ul>
 * An acknowledgment clears every outstanding attempt for its message id.
 */
@Slf4j
public abstract class BaseAgent {

    protected final String agentId;
    protected final String agentType;
    protected final String displayName;
    protected final AgentRuntime runtime;
    protected final AgentCoordinator coordinator;
    protected final A2aMessageBus messageBus;

    private final List<String> capabilities;
    private final Map<String, PendingDelivery> pendingAcks = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MessageDispatcher dispatcher = new MessageDispatcher();

    private volatile AgentRegistration registration;
    private volatile Disposable processingLoop;

    protected BaseAgent(String agentId, String agentType, String displayName,
                        List<String> capabilities, AgentRuntime runtime) {
        this.agentId = agentId;
        this.agentType = agentType;
        this.displayName = displayName;
        this.capabilities = List.copyOf(capabilities);
        this.runtime = runtime;
        this.coordinator = runtime.getCoordinator();
        this.messageBus = runtime.getMessageBus();
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    public Mono<Void> start() {
        return Mono.defer(() -> {
            if (running.get()) {
                return Mono.empty();
            }
            AgentRegistration reg = AgentRegistration.builder()
                    .agentId(agentId)
                    .agentType(agentType)
                    .capabilities(capabilities)
                    .registeredAt(runtime.getClock().instant())
                    .build();
            return coordinator.register(reg)
                    .doOnNext(ignored -> {
                        registration = reg;
                        DirectChannel channel = messageBus.listen(agentId);
                        running.set(true);
                        processingLoop = startProcessingLoop(channel);
                        log.info("Agent {} ({}) started", agentId, agentType);
                    })
                    .then(onStart());
        });
    }

    /**
     * Stops consuming and deregisters. Outstanding acknowledgment timeouts are cancelled and the
     * direct channel is closed.
     */
    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(true, false)) {
                return Mono.empty();
            }
            Disposable loop = processingLoop;
            if (loop != null) {
                loop.dispose();
            }
            messageBus.unlisten(agentId);
            pendingAcks.values().forEach(PendingDelivery::complete);
            pendingAcks.clear();

            return onStop()
                    .then(coordinator.deregister(agentId))
                    .doOnSuccess(ignored -> log.info("Agent {} stopped", agentId))
                    .then();
        });
    }

    protected Mono<Void> onStart() {
        return Mono.empty();
    }

    protected Mono<Void> onStop() {
        return Mono.empty();
    }

    // --------------------------------------------------------------------------------------------
    // Handlers
    // --------------------------------------------------------------------------------------------

    protected abstract Mono<Boolean> handleRequest(A2aRequest request);

    protected Mono<Boolean> handleResponse(A2aResponse response) {
        log.debug("Agent {} received response for request {} (success: {})",
                agentId, response.getRequestId(), response.isSuccess());
        return Mono.just(true);
    }

    protected Mono<Boolean> handleNotification(FrontendNotification notification) {
        log.debug("Agent {} received {} from {}: {}", agentId, notification.getNotificationType(),
                notification.getAgentId(), notification.getContent());
        return Mono.just(true);
    }

    protected Mono<Boolean> handleEvent(A2aEvent event) {
        log.info("Agent {} received {} message from {}: {}", agentId, event.getType(),
                event.getSender(), event.getContent());
        return Mono.just(true);
    }

    // --------------------------------------------------------------------------------------------
    // Sending
    // --------------------------------------------------------------------------------------------

    /**
     * Sends a message to its receiver.
     *
     * @return true once the bus accepted the message; false when transport retries were exhausted
     */
    public Mono<Boolean> send(A2aMessage message) {
        return Mono.defer(() -> {
            message.setSender(agentId);
            PendingDelivery pending = message.isRequiresAck()
                    ? pendingAcks.computeIfAbsent(message.getId(), id -> new PendingDelivery(message))
                    : null;

            return deliver(message).map(delivered -> {
                if (!delivered) {
                    if (pending != null && pendingAcks.remove(message.getId(), pending)) {
                        pending.complete();
                    }
                    runtime.getMetrics().getDeliveryFailures().increment();
                    runtime.getEventLogger().logDeliveryFailed(agentId, message.getId(),
                            message.getReceiver(), message.getType().getValue());
                    return false;
                }
                if (pending != null && pendingAcks.get(message.getId()) == pending) {
                    armAckTimeout(pending);
                }
                return true;
            });
        });
    }

    /**
     * Builds a request that requires acknowledgment. A fresh conversation id is used when none is given.
     */
    protected A2aRequest buildRequest(String receiver, RequestType requestType, RequestPayload payload,
                                      String conversationId) {
        A2aRequest.A2aRequestBuilder<?, ?> builder = A2aRequest.builder()
                .sender(agentId)
                .receiver(receiver)
                .requestType(requestType)
                .payload(payload)
                .requiresAck(true);
        if (conversationId != null) {
            builder.conversationId(conversationId);
        }
        return builder.build().validate();
    }

    public Mono<Boolean> sendRequest(String receiver, RequestType requestType, RequestPayload payload,
                                     String conversationId) {
        return Mono.fromCallable(() -> buildRequest(receiver, requestType, payload, conversationId))
                .flatMap(this::send);
    }

    /**
     * Replies to a request. Responses require acknowledgment so a lost reply is reported
     * back through {@link #handleDeliveryFailure(A2aMessage)}.
     */
    public Mono<Boolean> sendResponse(String receiver, String requestId, Map<String, Object> data,
                                      boolean success, String error, String conversationId) {
        A2aResponse.A2aResponseBuilder<?, ?> builder = A2aResponse.builder()
                .sender(agentId)
                .receiver(receiver)
                .requestId(requestId)
                .success(success)
                .error(error)
                .data(data != null ? data : Map.of())
                .requiresAck(true);
        if (conversationId != null) {
            builder.conversationId(conversationId);
        }
        return send(builder.build());
    }

    protected Mono<Boolean> reply(A2aRequest request, Map<String, Object> data) {
        return sendResponse(request.getSender(), request.getId(), data, true, null, request.getConversationId());
    }

    protected Mono<Boolean> replyFailure(A2aRequest request, String error) {
        return sendResponse(request.getSender(), request.getId(), Map.of(), false, error,
                request.getConversationId());
    }

    protected Mono<Boolean> notifyRequester(A2aRequest request, FrontendNotification.NotificationType type,
                                            String content) {
        return sendNotification(request.getSender(), type, content);
    }

    /**
     * Reports a failed request to its sender: an error notification followed by a failed response.
     *
     * @return always false, the request was not handled
     */
    protected Mono<Boolean> failRequest(A2aRequest request, String error) {
        log.warn("Agent {} failed request {} ({}): {}", agentId, request.getId(),
                request.getRequestType().getValue(), error);
        return notifyRequester(request, FrontendNotification.NotificationType.AGENT_ERROR, error)
                .then(replyFailure(request, error))
                .thenReturn(false);
    }

    protected Mono<Boolean> rejectUnsupported(A2aRequest request) {
        return failRequest(request, "Unsupported request type: " + request.getRequestType().getValue());
    }

    public Mono<Boolean> sendNotification(String receiver, FrontendNotification.NotificationType type,
                                          String content) {
        return send(FrontendNotification.builder()
                .sender(agentId)
                .receiver(receiver)
                .notificationType(type)
                .agentName(displayName)
                .agentId(agentId)
                .content(content)
                .requiresAck(false)
                .build());
    }

    public Mono<Boolean> broadcastMessage(A2aMessage message) {
        return Mono.defer(() -> {
            message.setSender(agentId);
            return messageBus.broadcast(message);
        });
    }

    // --------------------------------------------------------------------------------------------
    // Delivery failure
    // --------------------------------------------------------------------------------------------

    /**
     * Called once an ack-requiring message has exhausted its resends.
     *
     * <p>A lost response is reported to its intended receiver as an error message. A lost request
     * is turned into a failed response delivered to this agent's own {@link #handleResponse}.
     */
    protected Mono<Void> handleDeliveryFailure(A2aMessage message) {
        if (message.getType() == A2aMessageType.RESPONSE) {
            A2aEvent error = A2aEvent.error(agentId, message.getReceiver(), message.getConversationId(),
                    "Failed to deliver response to " + message.getReceiver());
            return deliver(error).then();
        }
        if (message.getType() == A2aMessageType.REQUEST) {
            A2aResponse failure = A2aResponse.failureFor((A2aRequest) message,
                    "No acknowledgment from " + message.getReceiver() + " after "
                            + (runtime.getMaxRetries() + 1) + " attempts");
            return handleResponse(failure)
                    .onErrorResume(e -> {
                        log.error("Agent {} failed handling delivery failure of {}: {}",
                                agentId, message.getId(), e.getMessage());
                        return Mono.just(false);
                    })
                    .then();
        }
        log.warn("Agent {} gave up delivering {} message {} to {}", agentId, message.getType(),
                message.getId(), message.getReceiver());
        return Mono.empty();
    }

    // --------------------------------------------------------------------------------------------
    // Status
    // --------------------------------------------------------------------------------------------

    public String getAgentId() {
        return agentId;
    }

    public String getAgentType() {
        return agentType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public AgentRegistration getRegistration() {
        return registration;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int pendingAckCount() {
        return pendingAcks.size();
    }

    public boolean isAwaitingAck(String messageId) {
        return pendingAcks.containsKey(messageId);
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Disposable startProcessingLoop(DirectChannel channel) {
        return Mono.defer(channel::receive)
                .publishOn(runtime.getScheduler())
                .flatMap(this::process)
                .repeat(running::get)
                .subscribe(
                        ignored -> { },
                        e -> log.error("Processing loop of agent {} terminated: {}", agentId, e.getMessage(), e));
    }

    private Mono<Boolean> process(A2aMessage message) {
        runtime.getEventLogger().setAgentContext(agentId, message.getConversationId());
        log.debug("Agent {} processing {} message {} from {}", agentId, message.getType(),
                message.getId(), message.getSender());

        Mono<Boolean> acknowledged = message.isRequiresAck()
                ? deliver(A2aAcknowledgment.of(message, agentId))
                : Mono.just(true);

        return acknowledged
                .then(Mono.defer(() -> message.accept(dispatcher)))
                .defaultIfEmpty(false)
                .doOnNext(handled -> {
                    if (!handled) {
                        log.warn("Agent {} did not handle {} message {}", agentId, message.getType(), message.getId());
                    }
                })
                .onErrorResume(e -> {
                    log.error("Agent {} failed handling message {}: {}", agentId, message.getId(), e.getMessage(), e);
                    return Mono.just(false);
                })
                .doFinally(signal -> runtime.getEventLogger().clearContext());
    }

    private Mono<Boolean> deliver(A2aMessage message) {
        String receiver = message.getReceiver();
        if (receiver == null) {
            log.error("Agent {} cannot send message {} without a receiver", agentId, message.getId());
            return Mono.just(false);
        }
        message.setSender(agentId);
        return Mono.defer(() -> messageBus.sendDirect(receiver, message))
                .flatMap(ok -> ok
                        ? Mono.just(true)
                        : Mono.<Boolean>error(new DeliveryException(message.getId(), receiver, "Bus rejected message")))
                .retryWhen(Retry.backoff(runtime.getMaxRetries(), runtime.getRetryBackoffBase())
                        .jitter(0d)
                        .scheduler(runtime.getScheduler())
                        .doBeforeRetry(signal -> {
                            runtime.getMetrics().getDeliveryRetries().increment();
                            runtime.getEventLogger().logDeliveryRetry(agentId, message.getId(), receiver,
                                    signal.totalRetries() + 1, signal.failure().getMessage());
                        }))
                .onErrorResume(e -> {
                    log.error("Agent {} failed to deliver {} to {} after {} retries: {}",
                            agentId, message.getId(), receiver, runtime.getMaxRetries(), e.getMessage());
                    return Mono.just(false);
                });
    }

    private void armAckTimeout(PendingDelivery pending) {
        Disposable timer = Mono.delay(runtime.getAckTimeout(), runtime.getScheduler())
                .subscribe(tick -> onAckTimeout(pending));
        pending.armTimer(timer);
    }

    private void onAckTimeout(PendingDelivery pending) {
        A2aMessage message = pending.getMessage();
        if (pendingAcks.get(message.getId()) != pending || !running.get()) {
            return;
        }
        runtime.getMetrics().getAckTimeouts().increment();

        if (pending.getRetryCount() < runtime.getMaxRetries()) {
            int attempt = pending.incrementRetryCount();
            log.warn("No acknowledgment for {} from {}, resending ({}/{})",
                    message.getId(), message.getReceiver(), attempt, runtime.getMaxRetries());
            runtime.getEventLogger().logAckTimeout(agentId, message.getId(), message.getReceiver(), attempt);
            send(message).subscribe(
                    ignored -> { },
                    e -> log.error("Resend of {} failed: {}", message.getId(), e.getMessage()));
            return;
        }

        if (pendingAcks.remove(message.getId(), pending)) {
            pending.complete();
            log.error("Giving up on {} to {} after {} resends", message.getId(), message.getReceiver(),
                    runtime.getMaxRetries());
            runtime.getMetrics().getDeliveryFailures().increment();
            runtime.getEventLogger().logDeliveryFailed(agentId, message.getId(), message.getReceiver(),
                    message.getType().getValue());
            handleDeliveryFailure(message).subscribe(
                    ignored -> { },
                    e -> log.error("Delivery failure handling for {} failed: {}", message.getId(), e.getMessage()));
        }
    }

    private Mono<Boolean> resolveAcknowledgment(A2aAcknowledgment ack) {
        PendingDelivery pending = pendingAcks.remove(ack.getAckForMessageId());
        if (pending == null) {
            log.warn("Agent {} received acknowledgment for unknown message {}", agentId, ack.getAckForMessageId());
            return Mono.just(false);
        }
        pending.complete();
        log.debug("Agent {} received acknowledgment for {} after {} resends",
                agentId, ack.getAckForMessageId(), pending.getRetryCount());
        return Mono.just(true);
    }

    private class MessageDispatcher implements A2aMessageVisitor<Mono<Boolean>> {

        @Override
        public Mono<Boolean> visitRequest(A2aRequest request) {
            return Mono.defer(() -> handleRequest(request))
                    .onErrorResume(InvalidMessageException.class, e -> failRequest(request, e.getMessage()));
        }

        @Override
        public Mono<Boolean> visitResponse(A2aResponse response) {
            return handleResponse(response);
        }

        @Override
        public Mono<Boolean> visitAcknowledgment(A2aAcknowledgment acknowledgment) {
            return resolveAcknowledgment(acknowledgment);
        }

        @Override
        public Mono<Boolean> visitFrontendNotification(FrontendNotification notification) {
            return handleNotification(notification);
        }

        @Override
        public Mono<Boolean> visitEvent(A2aEvent event) {
            return handleEvent(event);
        }
    }
}
