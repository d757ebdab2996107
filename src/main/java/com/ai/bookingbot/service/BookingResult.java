package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.exception.RejectionReason;

/**
 * Either the committed appointment or the reason the attempt lost.
 */
public record BookingResult(boolean success, Appointment appointment, RejectionReason reason) {

    public static BookingResult booked(Appointment appointment) {
        return new BookingResult(true, appointment, null);
    }

    public static BookingResult rejected(RejectionReason reason) {
        return new BookingResult(false, null, reason);
    }
}
