package com.ai.bookingbot.exception;

public class NotFoundException extends BookingException {

    public NotFoundException(ErrorCode errorCode, Object id) {
        super(errorCode, errorCode.getMessage() + " id=" + id);
    }
}
