package com.ai.bookingbot.exception;

public class AvailabilityException extends BookingException {

    private final RejectionReason reason;

    public AvailabilityException(RejectionReason reason) {
        super(reason.errorCode());
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
