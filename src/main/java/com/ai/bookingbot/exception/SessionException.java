package com.ai.bookingbot.exception;

public class SessionException extends BookingException {

    private final SessionError error;

    public SessionException(SessionError error) {
        super(error.errorCode());
        this.error = error;
    }

    public SessionError getError() {
        return error;
    }
}
