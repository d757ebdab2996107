package com.ai.bookingbot.service;

import com.ai.bookingbot.calendar.DailyHours;
import com.ai.bookingbot.calendar.WeeklySchedule;
import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.AvailabilityMode;
import com.ai.bookingbot.entity.BusinessHours;
import com.ai.bookingbot.entity.Extra;
import com.ai.bookingbot.entity.PricingTier;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.exception.ErrorCode;
import com.ai.bookingbot.exception.NotFoundException;
import com.ai.bookingbot.exception.ValidationException;
import com.ai.bookingbot.repository.BusinessHoursRepository;
import com.ai.bookingbot.repository.ExtraRepository;
import com.ai.bookingbot.repository.PricingTierRepository;
import com.ai.bookingbot.repository.SlotRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the effective configuration of a slot: its own hours and prices when it has
 * any, otherwise the provider defaults. Also holds the operator switches of a slot.
 */
@Service
public class SlotConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(SlotConfigurationService.class);

    private final SlotRepository slotRepository;
    private final BusinessHoursRepository businessHoursRepository;
    private final PricingTierRepository pricingTierRepository;
    private final ExtraRepository extraRepository;
    private final BookingProperties properties;

    public SlotConfigurationService(SlotRepository slotRepository,
                                    BusinessHoursRepository businessHoursRepository,
                                    PricingTierRepository pricingTierRepository,
                                    ExtraRepository extraRepository,
                                    BookingProperties properties) {
        this.slotRepository = slotRepository;
        this.businessHoursRepository = businessHoursRepository;
        this.pricingTierRepository = pricingTierRepository;
        this.extraRepository = extraRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public Slot requireSlot(Long slotId) {
        return slotRepository.findWithProviderById(slotId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.SLOT_NOT_FOUND, slotId));
    }

    /**
     * Slot a conversation is addressed to: the given one, else the provider's first active slot.
     */
    @Transactional(readOnly = true)
    public Slot resolveConversationSlot(Long providerId, Long slotId) {
        if (slotId != null) {
            return requireSlot(slotId);
        }
        List<Slot> slots = slotRepository.findByProviderIdAndActiveTrueOrderByIdAsc(providerId);
        if (slots.isEmpty()) {
            throw new NotFoundException(ErrorCode.SLOT_NOT_FOUND, "provider " + providerId);
        }
        return requireSlot(slots.get(0).getId());
    }

    @Transactional(readOnly = true)
    public Optional<Slot> findByWhatsappNumber(String whatsappNumber) {
        if (StringUtils.isBlank(whatsappNumber)) return Optional.empty();
        return slotRepository.findFirstByWhatsappNumberAndActiveTrue(whatsappNumber.trim());
    }

    public ZoneId zoneOf(Slot slot) {
        String zone = slot.getProvider() != null ? slot.getProvider().getTimeZone() : null;
        if (StringUtils.isBlank(zone)) zone = properties.getDefaultTimeZone();
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Invalid time zone '{}' for slot {}, using {}", zone, slot.getId(), properties.getDefaultTimeZone());
            return ZoneId.of(properties.getDefaultTimeZone());
        }
    }

    @Transactional(readOnly = true)
    public WeeklySchedule effectiveSchedule(Slot slot) {
        List<BusinessHours> rows = businessHoursRepository.findBySlotIdOrderByDayOfWeekAsc(slot.getId());
        if (rows.isEmpty()) {
            rows = businessHoursRepository.findByProviderIdAndSlotIsNullOrderByDayOfWeekAsc(slot.getProvider().getId());
        }
        Map<Integer, DailyHours> days = new HashMap<>();
        for (BusinessHours row : rows) {
            days.put(row.getDayOfWeek(), row.isClosed()
                    ? DailyHours.closedDay()
                    : DailyHours.open(row.getOpenTime(), row.getCloseTime()));
        }
        return WeeklySchedule.of(days);
    }

    /**
     * All tiers in effect for the slot, active or not.
     */
    @Transactional(readOnly = true)
    public List<PricingTier> effectiveTiers(Slot slot) {
        List<PricingTier> tiers = pricingTierRepository.findBySlotIdOrderByDurationMinutesAsc(slot.getId());
        if (!tiers.isEmpty()) return tiers;
        return pricingTierRepository.findByProviderIdAndSlotIsNullOrderByDurationMinutesAsc(slot.getProvider().getId());
    }

    @Transactional(readOnly = true)
    public List<Extra> extras(Slot slot) {
        return extraRepository.findByProviderIdOrderByCustomAscIdAsc(slot.getProvider().getId());
    }

    @Transactional
    public Slot updateAvailabilityMode(Long slotId, AvailabilityMode mode) {
        if (mode == null) throw new ValidationException("Availability mode is required.");
        Slot slot = requireSlot(slotId);
        AvailabilityMode previous = slot.getAvailabilityMode();
        slot.setAvailabilityMode(mode);
        slot = slotRepository.save(slot);
        log.info("Slot {} availability mode {} -> {}", slotId, previous, mode);
        return slot;
    }

    /**
     * Suspends automatic booking until the given instant; {@code null} lifts the override.
     */
    @Transactional
    public Slot setManualOverride(Long slotId, Instant until) {
        Slot slot = requireSlot(slotId);
        slot.setManualOverrideUntil(until);
        slot = slotRepository.save(slot);
        log.info("Slot {} manual override until {}", slotId, until);
        return slot;
    }
}
