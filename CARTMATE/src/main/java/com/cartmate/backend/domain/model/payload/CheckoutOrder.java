package com.cartmate.backend.domain.model.payload;

/**
 * Everything needed to place an order for the cart of a session.
 */
public record CheckoutOrder(
        String sessionId,
        String email,
        String currency,
        ShippingAddress address,
        CreditCard payment
) implements RequestPayload {

    public record ShippingAddress(
            String streetAddress,
            String city,
            String state,
            String country,
            String zipCode
    ) {
    }

    public record CreditCard(
            String number,
            int cvv,
            int expirationMonth,
            int expirationYear
    ) {
    }
}
