package com.ai.bookingbot.exception;

public enum SessionError {
    STALE_MAPPING(ErrorCode.STALE_MAPPING),
    SESSION_EXPIRED(ErrorCode.SESSION_EXPIRED);

    private final ErrorCode errorCode;

    SessionError(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
