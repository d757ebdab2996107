package com.ai.bookingbot.dto;

import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.PricingCategory;

import java.time.Instant;

public record AppointmentDto(Long id,
                             Long slotId,
                             String serviceRef,
                             String clientPhone,
                             String clientName,
                             Instant start,
                             Instant end,
                             int durationMinutes,
                             PricingCategory category,
                             Long totalPriceMinor,
                             Appointment.Status status) {

    public static AppointmentDto from(Appointment a) {
        return new AppointmentDto(a.getId(), a.getSlot().getId(), a.getServiceRef(), a.getClientPhone(),
                a.getClientName(), a.getStartTime(), a.getEndTime(), a.getDurationMinutes(), a.getCategory(),
                a.getTotalPriceMinor(), a.getStatus());
    }
}
