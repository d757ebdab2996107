package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.Extra;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.entity.PricingTier;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.exception.ErrorCode;
import com.ai.bookingbot.exception.PricingError;
import com.ai.bookingbot.exception.PricingException;
import com.ai.bookingbot.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Prices a draft from the slot's effective tiers and the provider's extras. Read-only.
 */
@Service
public class PricingService {

    private final SlotConfigurationService configuration;
    private final CategoryDurationPolicy policy;

    public PricingService(SlotConfigurationService configuration, CategoryDurationPolicy policy) {
        this.configuration = configuration;
        this.policy = policy;
    }

    @Transactional(readOnly = true)
    public PriceQuote quote(Slot slot, int durationMinutes, PricingCategory category, List<String> extraNames) {
        if (durationMinutes <= 0) {
            throw new ValidationException(ErrorCode.INVALID_DURATION, "Invalid duration: " + durationMinutes + " minutes.");
        }
        if (category == null) {
            throw new ValidationException("Pricing category is required.");
        }
        // the policy applies whatever tiers are configured
        if (!policy.allows(durationMinutes, category)) {
            throw new PricingException(PricingError.CATEGORY_UNAVAILABLE_FOR_DURATION, category + "/" + durationMinutes);
        }
        PricingTier tier = findTier(slot, durationMinutes, category)
                .orElseThrow(() -> new PricingException(PricingError.TIER_UNDEFINED, category + "/" + durationMinutes));
        if (!tier.isActive()) {
            throw new PricingException(PricingError.TIER_INACTIVE, category + "/" + durationMinutes);
        }

        List<Extra> catalogue = configuration.extras(slot);
        List<String> names = new ArrayList<>();
        long extrasTotal = 0;
        for (String requested : extraNames == null ? List.<String>of() : extraNames) {
            Extra extra = catalogue.stream()
                    .filter(e -> StringUtils.equalsIgnoreCase(StringUtils.trim(e.getName()), StringUtils.trim(requested)))
                    .findFirst()
                    .filter(Extra::isActive)
                    .orElseThrow(() -> new PricingException(PricingError.EXTRA_UNAVAILABLE, String.valueOf(requested)));
            names.add(extra.getName());
            extrasTotal += extra.getPriceMinor();
        }
        return new PriceQuote(durationMinutes, category, tier.getPriceMinor(), names, extrasTotal);
    }

    /**
     * Durations that can actually be sold for the category: active tier and allowed by the policy.
     */
    @Transactional(readOnly = true)
    public List<PricingTier> sellableTiers(Slot slot, PricingCategory category) {
        return configuration.effectiveTiers(slot).stream()
                .filter(PricingTier::isActive)
                .filter(t -> t.getCategory() == category)
                .filter(t -> policy.allows(t.getDurationMinutes(), category))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<PricingTier> sellableTiers(Slot slot) {
        return configuration.effectiveTiers(slot).stream()
                .filter(PricingTier::isActive)
                .filter(t -> policy.allows(t.getDurationMinutes(), t.getCategory()))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Extra> activeExtras(Slot slot) {
        return configuration.extras(slot).stream()
                .filter(Extra::isActive)
                .collect(Collectors.toList());
    }

    private Optional<PricingTier> findTier(Slot slot, int durationMinutes, PricingCategory category) {
        return configuration.effectiveTiers(slot).stream()
                .filter(t -> t.getDurationMinutes() == durationMinutes && t.getCategory() == category)
                .findFirst();
    }
}
