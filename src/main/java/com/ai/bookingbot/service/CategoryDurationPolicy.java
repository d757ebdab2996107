package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.PricingCategory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which pricing categories may be sold for a duration bucket, independent of the configured tiers.
 * Outcall is only offered from one hour on.
 */
@Component
public class CategoryDurationPolicy {

    private final Map<DurationBucket, Set<PricingCategory>> allowed = new EnumMap<>(DurationBucket.class);

    public CategoryDurationPolicy() {
        allowed.put(DurationBucket.UNDER_ONE_HOUR, Collections.unmodifiableSet(EnumSet.of(PricingCategory.PRIVATE)));
        allowed.put(DurationBucket.ONE_HOUR_OR_MORE,
                Collections.unmodifiableSet(EnumSet.of(PricingCategory.PRIVATE, PricingCategory.OUTCALL)));
    }

    public boolean allows(int durationMinutes, PricingCategory category) {
        return allowedCategories(durationMinutes).contains(category);
    }

    public Set<PricingCategory> allowedCategories(int durationMinutes) {
        return allowed.getOrDefault(DurationBucket.of(durationMinutes), Collections.emptySet());
    }
}
