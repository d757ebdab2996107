package com.ai.bookingbot.dto;

import com.ai.bookingbot.entity.AvailabilityMode;
import jakarta.validation.constraints.NotNull;

public record AvailabilityModeRequest(@NotNull AvailabilityMode mode) {
}
