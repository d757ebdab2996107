package com.ai.bookingbot.service;

public enum DurationBucket {
    UNDER_ONE_HOUR,
    ONE_HOUR_OR_MORE;

    public static DurationBucket of(int durationMinutes) {
        return durationMinutes < 60 ? UNDER_ONE_HOUR : ONE_HOUR_OR_MORE;
    }
}
