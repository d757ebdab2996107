package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.PricingCategory;

import java.util.List;

/**
 * Amounts are in minor currency units (cents).
 */
public record PriceQuote(int durationMinutes,
                         PricingCategory category,
                         long basePriceMinor,
                         List<String> extras,
                         long extrasTotalMinor) {

    public PriceQuote {
        extras = extras == null ? List.of() : List.copyOf(extras);
    }

    public long totalMinor() {
        return basePriceMinor + extrasTotalMinor;
    }
}
