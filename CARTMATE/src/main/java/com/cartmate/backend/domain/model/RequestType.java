package com.cartmate.backend.domain.model;

import com.cartmate.backend.domain.model.payload.AdQuery;
import com.cartmate.backend.domain.model.payload.CartCommand;
import com.cartmate.backend.domain.model.payload.CheckoutOrder;
import com.cartmate.backend.domain.model.payload.OrderReference;
import com.cartmate.backend.domain.model.payload.PriceComparisonQuery;
import com.cartmate.backend.domain.model.payload.ProductLookup;
import com.cartmate.backend.domain.model.payload.ProductQuery;
import com.cartmate.backend.domain.model.payload.RequestPayload;
import com.cartmate.backend.domain.model.payload.SessionScope;
import com.cartmate.backend.domain.model.payload.StyleQuery;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operations an agent can be asked to perform. Each type fixes the payload class
 * its request must carry.
 */
public enum RequestType {

    SEARCH_PRODUCTS("search_products", ProductQuery.class),
    GET_PRODUCT_DETAILS("get_product_details", ProductLookup.class),

    CREATE_CART("create_cart", SessionScope.class),
    ADD_TO_CART("add_to_cart", CartCommand.class),
    UPDATE_CART_ITEM("update_cart_item", CartCommand.class),
    REMOVE_FROM_CART("remove_from_cart", CartCommand.class),
    GET_CART("get_cart", SessionScope.class),
    CLEAR_CART("clear_cart", SessionScope.class),

    ANALYZE_STYLE("analyze_style", StyleQuery.class),
    COMPARE_PRICES("compare_prices", PriceComparisonQuery.class),

    PROCESS_CHECKOUT("process_checkout", CheckoutOrder.class),
    VALIDATE_ORDER("validate_order", CheckoutOrder.class),
    GET_ORDER_STATUS("get_order_status", OrderReference.class),
    CANCEL_ORDER("cancel_order", OrderReference.class),

    GET_ADS("get_ads", AdQuery.class);

    private final String value;
    private final Class<? extends RequestPayload> payloadType;

    RequestType(String value, Class<? extends RequestPayload> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends RequestPayload> getPayloadType() {
        return payloadType;
    }

    public boolean accepts(RequestPayload payload) {
        return payloadType.isInstance(payload);
    }
}
