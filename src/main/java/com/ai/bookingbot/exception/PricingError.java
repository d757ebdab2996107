package com.ai.bookingbot.exception;

public enum PricingError {
    TIER_INACTIVE(ErrorCode.TIER_INACTIVE),
    TIER_UNDEFINED(ErrorCode.TIER_UNDEFINED),
    CATEGORY_UNAVAILABLE_FOR_DURATION(ErrorCode.CATEGORY_UNAVAILABLE_FOR_DURATION),
    EXTRA_UNAVAILABLE(ErrorCode.EXTRA_UNAVAILABLE);

    private final ErrorCode errorCode;

    PricingError(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
