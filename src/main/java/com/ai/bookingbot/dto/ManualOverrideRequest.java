package com.ai.bookingbot.dto;

import java.time.Instant;

/**
 * {@code until == null} lifts the override.
 */
public record ManualOverrideRequest(Instant until) {
}
