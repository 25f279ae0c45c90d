package com.cartmate.backend.personalization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Shopping preferences a user shared for one session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonalizationProfile {

    private String sessionId;

    private String stylePreferences;

    private BudgetRange budgetRange;

    /**
     * Free-form attributes derived from an uploaded style image, when a client supplies them.
     */
    @Builder.Default
    private Map<String, Object> imageAnalysis = new HashMap<>();

    /**
     * Spending bounds in USD; either end may be open.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BudgetRange {
        private Double min;
        private Double max;
    }
}
