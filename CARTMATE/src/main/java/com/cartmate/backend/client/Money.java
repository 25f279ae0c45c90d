package com.cartmate.backend.client;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Amount in a currency, split into whole units and billionths as the commerce services report it.
 */
public record Money(String currencyCode, long units, int nanos) {

    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(units).add(BigDecimal.valueOf(nanos, 9));
    }

    public String format() {
        return String.format(Locale.ROOT, "%s %.2f", currencyCode != null ? currencyCode : "USD", toDecimal());
    }
}
