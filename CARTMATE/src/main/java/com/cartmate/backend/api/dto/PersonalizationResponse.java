package com.cartmate.backend.api.dto;

import com.cartmate.backend.personalization.PersonalizationProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for personalization operations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersonalizationResponse {

    private boolean success;
    private String message;
    private PersonalizationProfile data;
}
