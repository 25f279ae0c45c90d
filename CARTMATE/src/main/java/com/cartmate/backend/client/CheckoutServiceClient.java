package com.cartmate.backend.client;

import com.cartmate.backend.domain.model.payload.CheckoutOrder;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client interface for the checkout service.
 */
public interface CheckoutServiceClient {

    /**
     * Places an order for the user's current cart.
     */
    Mono<OrderResult> placeOrder(PlaceOrderRequest request);

    Mono<Boolean> isAvailable();

    record PlaceOrderRequest(
            String userId,
            String userCurrency,
            String email,
            CheckoutOrder.ShippingAddress address,
            CheckoutOrder.CreditCard creditCard
    ) {
    }

    record OrderResult(
            String orderId,
            String shippingTrackingId,
            Money shippingCost,
            List<OrderItem> items
    ) {
    }

    record OrderItem(String productId, int quantity, Money cost) {
    }
}
