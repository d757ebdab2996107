package com.ai.bookingbot.calendar;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Effective weekly hours keyed by day index, 0 = Sunday to 6 = Saturday.
 */
public final class WeeklySchedule {

    private static final WeeklySchedule EMPTY = new WeeklySchedule(Map.of());

    private final Map<Integer, DailyHours> days;

    private WeeklySchedule(Map<Integer, DailyHours> days) {
        this.days = Collections.unmodifiableMap(new HashMap<>(days));
    }

    public static WeeklySchedule of(Map<Integer, DailyHours> days) {
        for (Integer day : days.keySet()) {
            if (day == null || day < 0 || day > 6) {
                throw new IllegalArgumentException("Day of week must be 0..6, got " + day);
            }
        }
        return new WeeklySchedule(days);
    }

    public static WeeklySchedule empty() {
        return EMPTY;
    }

    public static int dayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    public Optional<DailyHours> forDay(DayOfWeek dayOfWeek) {
        DailyHours hours = days.get(dayIndex(dayOfWeek));
        if (hours == null || hours.closed()) return Optional.empty();
        return Optional.of(hours);
    }

    public int longestOpenMinutes() {
        return days.values().stream()
                .filter(hours -> !hours.closed())
                .mapToInt(DailyHours::openMinutes)
                .max()
                .orElse(0);
    }

    public boolean isEmpty() {
        return days.values().stream().allMatch(DailyHours::closed);
    }
}
