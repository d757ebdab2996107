package com.ai.bookingbot.exception;

/**
 * Quote failure; the conversation re-prompts the same step.
 */
public class PricingException extends BookingException {

    private final PricingError error;
    private final String detail;

    public PricingException(PricingError error, String detail) {
        super(error.errorCode(), error.errorCode().getMessage() + " (" + detail + ")");
        this.error = error;
        this.detail = detail;
    }

    public PricingError getError() {
        return error;
    }

    /** The duration, category or extra name the failure is about. */
    public String getDetail() {
        return detail;
    }
}
