package com.ai.bookingbot.exception;

/**
 * Malformed duration, category or extra; raised before storage is touched.
 */
public class ValidationException extends BookingException {

    public ValidationException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
