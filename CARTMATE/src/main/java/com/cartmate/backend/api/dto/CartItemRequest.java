package com.cartmate.backend.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding a product to a cart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemRequest {

    @NotBlank(message = "Product ID is required")
    private String productId;

    @Builder.Default
    @Min(value = 1, message = "Quantity must be at least 1")
    private int quantity = 1;
}
