package com.ai.bookingbot.calendar;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Supplies occupied ranges (appointments, blocked ranges) intersecting a query range.
 * Queried one open interval at a time so long horizons are never loaded at once.
 */
@FunctionalInterface
public interface BusyTimeSource {

    List<TimeWindow> busyBetween(Instant from, Instant to);

    static BusyTimeSource of(Collection<TimeWindow> busy) {
        List<TimeWindow> snapshot = List.copyOf(busy);
        return (from, to) -> snapshot.stream()
                .filter(w -> w.start().isBefore(to) && w.end().isAfter(from))
                .sorted()
                .collect(Collectors.toList());
    }
}
