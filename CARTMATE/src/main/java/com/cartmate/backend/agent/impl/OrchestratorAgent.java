package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.api.websocket.AgentStep;
import com.cartmate.backend.api.websocket.WebSocketGateway;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.A2aResponse;
import com.cartmate.backend.domain.model.AgentRegistration;
import com.cartmate.backend.domain.model.FrontendNotification;
import com.cartmate.backend.domain.model.FrontendNotification.NotificationType;
import com.cartmate.backend.domain.model.RequestType;
import com.cartmate.backend.domain.model.payload.AdQuery;
import com.cartmate.backend.domain.model.payload.PriceComparisonQuery;
import com.cartmate.backend.domain.model.payload.ProductQuery;
import com.cartmate.backend.domain.model.payload.RequestPayload;
import com.cartmate.backend.domain.model.payload.SessionScope;
import com.cartmate.backend.memory.ConversationMemory;
import com.cartmate.backend.memory.ConversationMemory.Entry;
import com.cartmate.backend.personalization.PersonalizationService;
import com.cartmate.backend.reasoning.IntentAnalyzer;
import com.cartmate.backend.reasoning.IntentAnalyzer.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for chat messages. Classifies what the user asks for, delegates to the worker
 * agent that can do it and turns the worker's response into a chat reply.
 *
 * <p>Delegated requests are tracked by request id until their response arrives. The response is
 * delivered to the chat asynchronously; {@link #handleUserMessage} only returns replies that need
 * no delegation.
 *
 * <p>Every user message, reply and agent result is recorded in the session's
 * {@link ConversationMemory}. Price comparisons work on the products shown earlier in it.
 */
@Component
@Slf4j
public class OrchestratorAgent extends BaseAgent {

    public static final String AGENT_ID = "orchestrator_001";
    public static final String AGENT_TYPE = "orchestrator";

    static final String ERROR_REPLY = "I'm sorry, I encountered an error processing your request. Please try again.";
    static final String CONVERSATION_REPLY = "I'm here to help with your shopping needs! I can search our catalog, "
            + "manage your cart, compare prices and help you check out. What can I assist you with today?";
    static final String CHECKOUT_REPLY = "I can help you check out. Please fill in your email, shipping address "
            + "and payment details in the checkout form.";
    static final String NOTHING_TO_COMPARE_REPLY = "Search for some products first and I'll compare their prices for you.";
    static final String NO_PRODUCTS_REPLY = "I couldn't find any products matching your search. Try different "
            + "keywords or let me know what specific type of item you're looking for!";

    private static final String FRONTEND = "frontend";

    private final IntentAnalyzer intentAnalyzer;
    private final WebSocketGateway gateway;
    private final ConversationMemory conversationMemory;
    private final PersonalizationService personalizationService;

    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();

    public OrchestratorAgent(AgentRuntime runtime, IntentAnalyzer intentAnalyzer, WebSocketGateway gateway,
                             ConversationMemory conversationMemory, PersonalizationService personalizationService) {
        super(AGENT_ID, AGENT_TYPE, "Orchestrator",
                List.of("conversation", "intent_analysis", "agent_coordination", "response_synthesis"), runtime);
        this.intentAnalyzer = intentAnalyzer;
        this.gateway = gateway;
        this.conversationMemory = conversationMemory;
        this.personalizationService = personalizationService;
    }

    /**
     * Delegated request awaiting its response.
     */
    record PendingRequest(String sessionId, RequestType requestType, String agentName) {
    }

    // --------------------------------------------------------------------------------------------
    // Chat entry points
    // --------------------------------------------------------------------------------------------

    /**
     * Handles one chat message.
     *
     * @return the reply to send right away, or an empty string when the answer will follow from a
     * delegated agent
     */
    public Mono<String> handleUserMessage(String sessionId, String message) {
        log.info("Orchestrator processing message from session {}: {}", sessionId, message);
        return gateway.sendTypingIndicator(sessionId, true)
                .then(conversationMemory.store(sessionId, Entry.userMessage(message)))
                .then(notifyBackchannel(NotificationType.AGENT_THINKING, "Analyzing your request..."))
                .then(intentAnalyzer.analyze(message, sessionId))
                .flatMap(intent -> {
                    log.info("Intent for session {}: {} (confidence {})", sessionId, intent.type(), intent.confidence());
                    return route(sessionId, message, intent);
                })
                .onErrorResume(e -> {
                    log.error("Error handling user message for session {}: {}", sessionId, e.getMessage(), e);
                    return Mono.just(ERROR_REPLY);
                })
                .defaultIfEmpty(ERROR_REPLY)
                .flatMap(reply -> remember(sessionId, reply)
                        .then(gateway.sendTypingIndicator(sessionId, false))
                        .thenReturn(reply));
    }

    /**
     * Asks the ads agent for ads; the result is pushed to the session as an {@code ads} frame.
     */
    public Mono<Boolean> requestAds(String sessionId, List<String> contextKeys) {
        return delegate(sessionId, AdsAgent.AGENT_TYPE, "Ads Agent", RequestType.GET_ADS,
                new AdQuery(sessionId, contextKeys), null);
    }

    /**
     * Forgets delegated requests and the conversation history of a session.
     */
    public Mono<Void> clearSessionContext(String sessionId) {
        return Mono.fromRunnable(() -> pendingRequests.values()
                        .removeIf(pending -> pending.sessionId().equals(sessionId)))
                .then(conversationMemory.clear(sessionId))
                .doOnSuccess(ignored -> log.info("Cleared orchestrator context for session {}", sessionId))
                .then();
    }

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    // --------------------------------------------------------------------------------------------
    // A2A handlers
    // --------------------------------------------------------------------------------------------

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return rejectUnsupported(request);
    }

    @Override
    protected Mono<Boolean> handleResponse(A2aResponse response) {
        PendingRequest pending = pendingRequests.remove(response.getRequestId());
        if (pending == null) {
            log.warn("Received response for unknown request {}", response.getRequestId());
            return Mono.just(false);
        }
        String sessionId = pending.sessionId();
        String agentName = pending.agentName();

        if (!response.isSuccess()) {
            return gateway.updateAgentCommunication(sessionId,
                            List.of(AgentStep.of("calling", AgentStep.ERROR, agentName, "Failed")))
                    .then(gateway.sendMessage(sessionId, "text",
                            agentName + " encountered an error: " + response.getError() + ". Please try again."))
                    .thenReturn(true);
        }

        if (pending.requestType() == RequestType.GET_ADS) {
            return gateway.sendMessage(sessionId, "ads", response.getData()).thenReturn(true);
        }

        Object content = replyContent(pending, response.getData());
        return gateway.updateAgentCommunication(sessionId, List.of(
                        AgentStep.of("calling", AgentStep.SUCCESS, agentName, "Connected"),
                        AgentStep.of("processing", AgentStep.PROCESSING, agentName, "Processing results...")))
                .then(gateway.sendMessage(sessionId, "text", content))
                .then(rememberResult(pending, response.getData(), content))
                .then(gateway.updateAgentCommunication(sessionId, List.of(
                        AgentStep.of("calling", AgentStep.SUCCESS, agentName, "Connected"),
                        AgentStep.of("processing", AgentStep.SUCCESS, agentName, "Completed"))))
                .thenReturn(true);
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<String> route(String sessionId, String message, Intent intent) {
        switch (intent.type()) {
            case PRODUCT_SEARCH: {
                String query = intent.searchQuery() == null || intent.searchQuery().isBlank()
                        ? message
                        : intent.searchQuery();
                return delegate(sessionId, ProductDiscoveryAgent.AGENT_TYPE, "Product Discovery Agent",
                        RequestType.SEARCH_PRODUCTS, new ProductQuery(query, sessionId),
                        "I'll help you find products! Let me search our catalog for: '" + query + "'")
                        .thenReturn("");
            }
            case CART_MANAGEMENT:
                return delegate(sessionId, CartManagementAgent.AGENT_TYPE, "Cart Management Agent",
                        RequestType.GET_CART, new SessionScope(sessionId), "Let me check your cart.")
                        .thenReturn("");
            case PRICE_COMPARISON:
                return conversationMemory.getRecentProducts(sessionId)
                        .flatMap(products -> products.isEmpty()
                                ? Mono.just(NOTHING_TO_COMPARE_REPLY)
                                : delegate(sessionId, PriceComparisonAgent.AGENT_TYPE, "Price Comparison Agent",
                                RequestType.COMPARE_PRICES, new PriceComparisonQuery(sessionId, products),
                                "Let me compare prices for the products I found.")
                                .thenReturn(""));
            case CHECKOUT:
                return Mono.just(CHECKOUT_REPLY);
            default:
                return personalizationService.get(sessionId)
                        .map(profile -> CONVERSATION_REPLY + " I'll keep your preferences in mind ("
                                + PersonalizationService.describe(profile) + ").")
                        .defaultIfEmpty(CONVERSATION_REPLY);
        }
    }

    /**
     * Sends a request to the first registered agent of a type and tracks it until its response.
     *
     * @return true once the request was handed to the bus; on false the failure has already been
     * reported to the chat
     */
    private Mono<Boolean> delegate(String sessionId, String agentType, String agentName, RequestType requestType,
                                  RequestPayload payload, String acknowledgment) {
        Mono<Boolean> acknowledge = acknowledgment != null
                ? gateway.sendMessage(sessionId, "text", acknowledgment)
                : Mono.just(true);

        return acknowledge
                .then(notifyBackchannel(NotificationType.AGENT_DELEGATION, "Calling " + agentName))
                .then(Mono.defer(() -> {
                    Optional<AgentRegistration> target = coordinator.findByType(agentType);
                    if (target.isEmpty()) {
                        log.warn("No {} agent registered", agentType);
                        return gateway.sendMessage(sessionId, "text",
                                agentName + " is currently unavailable. Please try again later.").thenReturn(false);
                    }

                    A2aRequest request = buildRequest(target.get().getAgentId(), requestType, payload, sessionId);
                    pendingRequests.put(request.getId(), new PendingRequest(sessionId, requestType, agentName));

                    return gateway.sendAgentCommunication(sessionId,
                                    List.of(AgentStep.of("calling", AgentStep.CALLING, agentName, "Connecting...")))
                            .then(send(request))
                            .flatMap(sent -> {
                                if (sent) {
                                    return Mono.just(true);
                                }
                                pendingRequests.remove(request.getId());
                                return gateway.sendMessage(sessionId, "text", "Having trouble connecting to the "
                                        + agentName + ". Please try again.").thenReturn(false);
                            });
                }));
    }

    private Object replyContent(PendingRequest pending, Map<String, Object> data) {
        switch (pending.requestType()) {
            case SEARCH_PRODUCTS: {
                List<Map<String, Object>> products = productsOf(data);
                String message = products.isEmpty()
                        ? NO_PRODUCTS_REPLY
                        : "I found " + products.size() + " products for you! Browse through them below and let me "
                        + "know if you'd like more details about any specific item, or if you'd like to search "
                        + "for something else.";
                return Map.of("message", message, "products", products);
            }
            case GET_CART: {
                Object total = data.get("total_quantity");
                return total instanceof Number && ((Number) total).intValue() > 0
                        ? "Your cart has " + total + " item(s)."
                        : "Your cart is empty.";
            }
            case COMPARE_PRICES:
                return String.valueOf(data.getOrDefault("summary", "Price comparison completed."));
            default:
                return String.valueOf(data.getOrDefault("message", "Done."));
        }
    }

    private Mono<Boolean> remember(String sessionId, String reply) {
        return reply.isEmpty()
                ? Mono.just(false)
                : conversationMemory.store(sessionId, Entry.assistantMessage(reply));
    }

    /**
     * Records a worker's result. Search results keep their products so later turns can refer to them.
     */
    private Mono<Boolean> rememberResult(PendingRequest pending, Map<String, Object> data, Object content) {
        String sessionId = pending.sessionId();
        switch (pending.requestType()) {
            case SEARCH_PRODUCTS: {
                List<Map<String, Object>> products = productsOf(data);
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("products", products);
                metadata.put("product_count", products.size());
                return conversationMemory.store(sessionId, Entry.agentResult(pending.agentName(),
                        ConversationMemory.PRODUCT_SEARCH, "Found " + products.size() + " products", metadata));
            }
            case COMPARE_PRICES:
                return conversationMemory.store(sessionId, Entry.agentResult(pending.agentName(),
                        ConversationMemory.PRICE_COMPARISON, String.valueOf(content), Map.of("price_data", data)));
            default:
                return remember(sessionId, String.valueOf(content));
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> productsOf(Map<String, Object> data) {
        Object products = data.get("products");
        return products instanceof List ? (List<Map<String, Object>>) products : List.of();
    }

    private Mono<Boolean> notifyBackchannel(NotificationType type, String content) {
        FrontendNotification notification = FrontendNotification.builder()
                .sender(agentId)
                .receiver(FRONTEND)
                .notificationType(type)
                .agentName(displayName)
                .agentId(agentId)
                .content(content)
                .requiresAck(false)
                .build();
        return gateway.sendA2aMessageToBackchannel(notification.toPayload());
    }
}
