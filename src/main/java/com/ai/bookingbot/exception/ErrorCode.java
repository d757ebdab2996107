package com.ai.bookingbot.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes with HTTP status and default message.
 */
public enum ErrorCode {
    // Validation
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "V001", "Invalid input."),
    INVALID_DURATION(HttpStatus.BAD_REQUEST, "V002", "Duration must be between 1 and 1440 minutes."),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT, "V003", "Status transition not allowed."),

    // Lookup
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, "N001", "Slot not found."),
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "N002", "Appointment not found."),
    PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "N003", "Provider not found."),

    // Availability
    SLOT_TAKEN(HttpStatus.CONFLICT, "A001", "The requested time is already booked."),
    NO_LONGER_AVAILABLE(HttpStatus.CONFLICT, "A002", "The requested time is no longer available."),
    MODE_CLOSED(HttpStatus.CONFLICT, "A003", "The slot is not accepting automatic bookings."),

    // Pricing
    TIER_INACTIVE(HttpStatus.UNPROCESSABLE_ENTITY, "P001", "This duration is currently not offered."),
    TIER_UNDEFINED(HttpStatus.UNPROCESSABLE_ENTITY, "P002", "No price is defined for this duration."),
    CATEGORY_UNAVAILABLE_FOR_DURATION(HttpStatus.UNPROCESSABLE_ENTITY, "P003", "This category is not offered for this duration."),
    EXTRA_UNAVAILABLE(HttpStatus.UNPROCESSABLE_ENTITY, "P004", "Extra not available."),

    // Session
    STALE_MAPPING(HttpStatus.CONFLICT, "S001", "The list of options has changed."),
    SESSION_EXPIRED(HttpStatus.GONE, "S002", "The conversation has expired.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
