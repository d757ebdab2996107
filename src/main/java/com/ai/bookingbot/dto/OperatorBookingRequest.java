package com.ai.bookingbot.dto;

import com.ai.bookingbot.entity.PricingCategory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record OperatorBookingRequest(@NotNull Instant start,
                                     @Min(1) @Max(1440) int durationMinutes,
                                     @NotBlank String clientPhone,
                                     String clientName,
                                     String serviceRef,
                                     PricingCategory category,
                                     Long totalPriceMinor,
                                     String notes) {
}
