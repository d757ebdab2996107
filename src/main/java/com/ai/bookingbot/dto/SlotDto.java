package com.ai.bookingbot.dto;

import com.ai.bookingbot.entity.AvailabilityMode;
import com.ai.bookingbot.entity.Slot;

import java.time.Instant;

public record SlotDto(Long id, String name, AvailabilityMode availabilityMode, Instant manualOverrideUntil, boolean active) {

    public static SlotDto from(Slot slot) {
        return new SlotDto(slot.getId(), slot.getName(), slot.getAvailabilityMode(), slot.getManualOverrideUntil(), slot.isActive());
    }
}
