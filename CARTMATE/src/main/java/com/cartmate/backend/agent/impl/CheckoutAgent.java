package com.cartmate.backend.agent.impl;

import com.cartmate.backend.agent.AgentRuntime;
import com.cartmate.backend.agent.BaseAgent;
import com.cartmate.backend.cart.CartService;
import com.cartmate.backend.client.CheckoutServiceClient;
import com.cartmate.backend.client.CheckoutServiceClient.OrderResult;
import com.cartmate.backend.client.CheckoutServiceClient.PlaceOrderRequest;
import com.cartmate.backend.config.CartmateProperties;
import com.cartmate.backend.domain.model.A2aRequest;
import com.cartmate.backend.domain.model.payload.CheckoutOrder;
import com.cartmate.backend.domain.model.payload.OrderReference;
import com.cartmate.backend.storage.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_ACTION;
import static com.cartmate.backend.domain.model.FrontendNotification.NotificationType.AGENT_THINKING;

/**
 * Places and tracks orders. The last order of a session is kept in the key-value store under
 * {@code order:{sessionId}} for status lookups and cancellation.
 */
@Component
@Slf4j
public class CheckoutAgent extends BaseAgent {

    public static final String AGENT_ID = "checkout_001";
    public static final String AGENT_TYPE = "checkout";

    static final String ORDER_KEY_PREFIX = "order:";
    static final String STATUS_CONFIRMED = "confirmed";
    static final String STATUS_CANCELLED = "cancelled";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
    private static final String DEFAULT_CURRENCY = "USD";

    private final CheckoutServiceClient checkoutClient;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration orderTtl;

    public CheckoutAgent(AgentRuntime runtime, CheckoutServiceClient checkoutClient, KeyValueStore store,
                         ObjectMapper objectMapper, CartmateProperties properties) {
        super(AGENT_ID, AGENT_TYPE, "Checkout Agent",
                List.of("process_checkout", "validate_order", "process_payment", "get_order_status", "cancel_order"),
                runtime);
        this.checkoutClient = checkoutClient;
        this.store = store;
        this.objectMapper = objectMapper;
        this.orderTtl = properties.getSession().getTtl();
    }

    @Override
    protected Mono<Boolean> handleRequest(A2aRequest request) {
        return switch (request.getRequestType()) {
            case PROCESS_CHECKOUT -> processCheckout(request, request.payloadAs(CheckoutOrder.class));
            case VALIDATE_ORDER -> validateOrder(request, request.payloadAs(CheckoutOrder.class));
            case GET_ORDER_STATUS -> getOrderStatus(request, request.payloadAs(OrderReference.class));
            case CANCEL_ORDER -> cancelOrder(request, request.payloadAs(OrderReference.class));
            default -> rejectUnsupported(request);
        };
    }

    /**
     * Problems that prevent the order from being placed; empty when the order is complete.
     */
    static List<String> validate(CheckoutOrder order) {
        List<String> errors = new ArrayList<>();
        if (isBlank(order.email())) {
            errors.add("Missing required field: email");
        } else if (!order.email().contains("@")) {
            errors.add("Invalid email format");
        }

        CheckoutOrder.ShippingAddress address = order.address();
        if (address == null) {
            errors.add("Missing required field: address");
        } else {
            requireField(errors, "address", "street_address", address.streetAddress());
            requireField(errors, "address", "city", address.city());
            requireField(errors, "address", "state", address.state());
            requireField(errors, "address", "country", address.country());
            requireField(errors, "address", "zip_code", address.zipCode());
        }

        CheckoutOrder.CreditCard card = order.payment();
        if (card == null) {
            errors.add("Missing required field: credit_card");
        } else {
            requireField(errors, "credit card", "number", card.number());
            if (card.cvv() <= 0) {
                errors.add("Missing credit card field: cvv");
            }
            if (card.expirationMonth() < 1 || card.expirationMonth() > 12) {
                errors.add("Missing credit card field: expiration_month");
            }
            if (card.expirationYear() <= 0) {
                errors.add("Missing credit card field: expiration_year");
            }
        }
        return errors;
    }

    // --------------------------------------------------------------------------------------------
    // Operations
    // --------------------------------------------------------------------------------------------

    private Mono<Boolean> processCheckout(A2aRequest request, CheckoutOrder order) {
        List<String> errors = validate(order);
        if (!errors.isEmpty()) {
            return failRequest(request, "Order validation failed: " + String.join(", ", errors));
        }
        return checkoutClient.isAvailable().flatMap(available -> {
            if (!available) {
                return failRequest(request, "Checkout service unavailable");
            }
            PlaceOrderRequest placeOrder = new PlaceOrderRequest(
                    CartService.userIdFor(order.sessionId()),
                    order.currency() != null ? order.currency() : DEFAULT_CURRENCY,
                    order.email(),
                    order.address(),
                    order.payment());

            return notifyRequester(request, AGENT_THINKING, "Processing checkout...")
                    .then(checkoutClient.placeOrder(placeOrder))
                    .flatMap(result -> {
                        Map<String, Object> record = orderRecord(result, order);
                        return storeOrder(order.sessionId(), record)
                                .then(notifyRequester(request, AGENT_ACTION,
                                        "Order " + result.orderId() + " placed successfully"))
                                .then(reply(request, record));
                    })
                    .onErrorResume(e -> failRequest(request, "Checkout failed: " + e.getMessage()));
        });
    }

    private Mono<Boolean> validateOrder(A2aRequest request, CheckoutOrder order) {
        return notifyRequester(request, AGENT_THINKING, "Validating order...")
                .then(Mono.defer(() -> {
                    List<String> errors = validate(order);
                    boolean valid = errors.isEmpty();
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("valid", valid);
                    data.put("errors", errors);
                    data.put("warnings", List.of());
                    String summary = valid
                            ? "Order validation successful"
                            : "Order validation failed: " + errors.size() + " error(s)";
                    return notifyRequester(request, AGENT_ACTION, summary)
                            .then(sendResponse(request.getSender(), request.getId(), data, valid,
                                    valid ? null : summary, request.getConversationId()));
                }));
    }

    private Mono<Boolean> getOrderStatus(A2aRequest request, OrderReference reference) {
        return notifyRequester(request, AGENT_THINKING, "Retrieving order status...")
                .then(loadOrder(reference))
                .flatMap(order -> notifyRequester(request, AGENT_ACTION,
                                "Order status retrieved for order " + reference.orderId())
                        .then(reply(request, order)))
                .switchIfEmpty(Mono.defer(() -> failRequest(request, "Order " + reference.orderId() + " not found")));
    }

    private Mono<Boolean> cancelOrder(A2aRequest request, OrderReference reference) {
        return notifyRequester(request, AGENT_THINKING, "Cancelling order...")
                .then(loadOrder(reference))
                .flatMap(order -> {
                    if (STATUS_CANCELLED.equals(order.get("status"))) {
                        return failRequest(request, "Order " + reference.orderId() + " is already cancelled");
                    }
                    order.put("status", STATUS_CANCELLED);
                    order.put("cancelled_at", runtime.getClock().instant().toString());
                    return storeOrder(reference.sessionId(), order)
                            .then(notifyRequester(request, AGENT_ACTION,
                                    "Order " + reference.orderId() + " cancelled successfully"))
                            .then(reply(request, order));
                })
                .switchIfEmpty(Mono.defer(() -> failRequest(request, "Order " + reference.orderId() + " not found")));
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Map<String, Object> orderRecord(OrderResult result, CheckoutOrder order) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("order_id", result.orderId());
        record.put("status", STATUS_CONFIRMED);
        record.put("tracking_number", result.shippingTrackingId());
        record.put("shipping_cost", result.shippingCost() != null ? result.shippingCost().format() : null);
        record.put("items", objectMapper.convertValue(result.items() != null ? result.items() : List.of(),
                new TypeReference<List<Map<String, Object>>>() { }));
        record.put("email", order.email());
        record.put("estimated_delivery", "3-5 business days");
        record.put("placed_at", runtime.getClock().instant().toString());
        return record;
    }

    private Mono<Boolean> storeOrder(String sessionId, Map<String, Object> record) {
        try {
            return store.set(ORDER_KEY_PREFIX + sessionId, objectMapper.writeValueAsString(record), orderTtl)
                    .onErrorResume(e -> {
                        log.error("Failed to store order for session {}: {}", sessionId, e.getMessage());
                        return Mono.just(false);
                    });
        } catch (JsonProcessingException e) {
            log.error("Could not serialize order for session {}: {}", sessionId, e.getMessage());
            return Mono.just(false);
        }
    }

    private Mono<Map<String, Object>> loadOrder(OrderReference reference) {
        return store.get(ORDER_KEY_PREFIX + reference.sessionId())
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, MAP_TYPE));
                    } catch (JsonProcessingException e) {
                        log.error("Corrupt order record for session {}: {}", reference.sessionId(), e.getMessage());
                        return Mono.empty();
                    }
                })
                .filter(order -> reference.orderId() != null && reference.orderId().equals(order.get("order_id")))
                .<Map<String, Object>>map(LinkedHashMap::new);
    }

    private static void requireField(List<String> errors, String group, String field, String value) {
        if (isBlank(value)) {
            errors.add("Missing " + group + " field: " + field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
