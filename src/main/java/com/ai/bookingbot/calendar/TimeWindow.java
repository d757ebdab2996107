package com.ai.bookingbot.calendar;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time range [start, end).
 */
public record TimeWindow(Instant start, Instant end) implements Comparable<TimeWindow> {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end must be after start: " + start + " / " + end);
        }
    }

    public static TimeWindow ofMinutes(Instant start, int minutes) {
        return new TimeWindow(start, start.plus(Duration.ofMinutes(minutes)));
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public int compareTo(TimeWindow o) {
        int c = start.compareTo(o.start);
        return c != 0 ? c : end.compareTo(o.end);
    }
}
