package com.ai.bookingbot.service;

/**
 * Who asks for the booking. Operators own the channel, so the mode gate does not apply to them.
 */
public enum BookingOrigin {
    BOT,
    OPERATOR
}
