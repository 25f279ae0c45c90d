package com.cartmate.backend.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for cart operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    private boolean success;
    private String message;
    private Map<String, Object> cartData;

    public static CartResponse ok(String message, Map<String, Object> cartData) {
        return new CartResponse(true, message, cartData);
    }

    public static CartResponse failed(String message) {
        return new CartResponse(false, message, null);
    }
}
