package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.PricingCategory;
import lombok.Builder;

import java.time.Instant;

@Builder
public record BookingRequest(Long slotId,
                             Instant start,
                             int durationMinutes,
                             String clientPhone,
                             String clientName,
                             String serviceRef,
                             PricingCategory category,
                             Long totalPriceMinor,
                             Long sessionId,
                             String notes,
                             BookingOrigin origin) {
}
