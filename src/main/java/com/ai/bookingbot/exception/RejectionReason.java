package com.ai.bookingbot.exception;

/**
 * Why a booking attempt was refused. All of them are recovered by offering fresh windows.
 */
public enum RejectionReason {
    SLOT_TAKEN(ErrorCode.SLOT_TAKEN),
    NO_LONGER_AVAILABLE(ErrorCode.NO_LONGER_AVAILABLE),
    MODE_CLOSED(ErrorCode.MODE_CLOSED);

    private final ErrorCode errorCode;

    RejectionReason(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
