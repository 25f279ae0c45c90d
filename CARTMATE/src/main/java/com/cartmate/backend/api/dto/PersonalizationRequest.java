package com.cartmate.backend.api.dto;

import com.cartmate.backend.personalization.PersonalizationProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for saving a session's personalization data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonalizationRequest {

    @Size(max = 1000, message = "Style preferences must be less than 1000 characters")
    private String stylePreferences;

    @PositiveOrZero(message = "Budget minimum must not be negative")
    private Double budgetMin;

    @PositiveOrZero(message = "Budget maximum must not be negative")
    private Double budgetMax;

    private Map<String, Object> imageAnalysis;

    @JsonIgnore
    @AssertTrue(message = "Budget minimum must not exceed the maximum")
    public boolean isBudgetOrdered() {
        return budgetMin == null || budgetMax == null || budgetMin <= budgetMax;
    }

    /**
     * Convert to domain model.
     */
    public PersonalizationProfile toProfile(String sessionId) {
        return PersonalizationProfile.builder()
                .sessionId(sessionId)
                .stylePreferences(stylePreferences)
                .budgetRange(new PersonalizationProfile.BudgetRange(budgetMin, budgetMax))
                .imageAnalysis(imageAnalysis != null ? imageAnalysis : new HashMap<>())
                .build();
    }
}
