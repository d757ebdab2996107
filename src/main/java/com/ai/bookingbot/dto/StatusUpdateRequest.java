package com.ai.bookingbot.dto;

import com.ai.bookingbot.entity.Appointment;
import jakarta.validation.constraints.NotNull;

public record StatusUpdateRequest(@NotNull Appointment.Status status) {
}
