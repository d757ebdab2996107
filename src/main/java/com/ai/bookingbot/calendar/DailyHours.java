package com.ai.bookingbot.calendar;

import java.time.LocalTime;

/**
 * Opening hours of one weekday. A close time not after the open time means the day runs
 * past midnight.
 */
public record DailyHours(LocalTime open, LocalTime close, boolean closed) {

    public static DailyHours open(LocalTime open, LocalTime close) {
        return new DailyHours(open, close, false);
    }

    public static DailyHours closedDay() {
        return new DailyHours(LocalTime.MIDNIGHT, LocalTime.MIDNIGHT, true);
    }

    public boolean spansMidnight() {
        return !close.isAfter(open);
    }

    /**
     * Length of the open interval in local minutes, ignoring zone offset changes.
     */
    public int openMinutes() {
        int minutes = close.toSecondOfDay() / 60 - open.toSecondOfDay() / 60;
        return spansMidnight() ? minutes + 24 * 60 : minutes;
    }
}
