package com.cartmate.backend.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for setting the quantity of a cart line. Zero removes the line.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CartQuantityRequest {

    @NotNull(message = "Quantity is required")
    @Min(value = 0, message = "Quantity must not be negative")
    private Integer quantity;
}
