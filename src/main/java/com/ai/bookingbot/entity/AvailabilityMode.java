package com.ai.bookingbot.entity;

/**
 * Accept/reject policy of a slot towards automated booking.
 */
public enum AvailabilityMode {
    ACTIVE,
    AWAY,
    GHOST
}
