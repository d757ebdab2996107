package com.ai.bookingbot.calendar;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pure availability computation: weekly hours minus busy ranges, produced lazily in
 * chronological order. Same inputs always yield the same sequence.
 */
public final class AvailabilityCalculator {

    /**
     * Days scanned when no last day is given.
     */
    public static final int UNBOUNDED_SCAN_DAYS = 366;

    private AvailabilityCalculator() {
    }

    /**
     * Disjoint free windows of at least {@code durationMinutes}, from {@code firstDay} to
     * {@code lastDay} inclusive, never starting before {@code notBefore}. A {@code null}
     * {@code lastDay} scans up to {@link #UNBOUNDED_SCAN_DAYS} days.
     */
    public static Stream<TimeWindow> availableWindows(WeeklySchedule schedule,
                                                      ZoneId zone,
                                                      LocalDate firstDay,
                                                      LocalDate lastDay,
                                                      Instant notBefore,
                                                      BusyTimeSource busy,
                                                      int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + durationMinutes);
        }
        // an hour of slack for days that gain an hour at a zone offset change
        if (schedule.isEmpty() || schedule.longestOpenMinutes() + 60 < durationMinutes) {
            return Stream.empty();
        }
        LocalDate scanEnd = lastDay != null ? lastDay : firstDay.plusDays(UNBOUNDED_SCAN_DAYS);
        Iterator<TimeWindow> it = new WindowIterator(schedule, zone, firstDay, scanEnd, notBefore, busy,
                Duration.ofMinutes(durationMinutes));
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it,
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT), false);
    }

    /**
     * Splits free windows into concrete bookable ranges of exactly {@code durationMinutes},
     * starting on multiples of {@code stepMinutes} after local midnight.
     */
    public static Stream<TimeWindow> openings(Stream<TimeWindow> windows, int durationMinutes, int stepMinutes, ZoneId zone) {
        if (stepMinutes <= 0) {
            throw new IllegalArgumentException("Step must be positive: " + stepMinutes);
        }
        Duration duration = Duration.ofMinutes(durationMinutes);
        Duration step = Duration.ofMinutes(stepMinutes);
        return windows.flatMap(window -> {
            Instant first = alignUp(window.start(), stepMinutes, zone);
            return Stream.iterate(first,
                            start -> !start.plus(duration).isAfter(window.end()),
                            start -> start.plus(step))
                    .map(start -> new TimeWindow(start, start.plus(duration)));
        });
    }

    /**
     * Open interval of a calendar day, if the day is open.
     */
    public static Optional<TimeWindow> openInterval(WeeklySchedule schedule, ZoneId zone, LocalDate day) {
        return schedule.forDay(day.getDayOfWeek()).map(hours -> {
            Instant open = ZonedDateTime.of(day, hours.open(), zone).toInstant();
            LocalDate closeDay = hours.spansMidnight() ? day.plusDays(1) : day;
            Instant close = ZonedDateTime.of(closeDay, hours.close(), zone).toInstant();
            return new TimeWindow(open, close);
        });
    }

    /**
     * True when the proposal fits entirely inside one daily open interval.
     */
    public static boolean isWithinOpenHours(WeeklySchedule schedule, ZoneId zone, TimeWindow proposal) {
        LocalDate startDay = proposal.start().atZone(zone).toLocalDate();
        // an interval opened the previous evening may still be running
        for (LocalDate day : List.of(startDay.minusDays(1), startDay)) {
            Optional<TimeWindow> interval = openInterval(schedule, zone, day);
            if (interval.isPresent() && interval.get().contains(proposal)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Interval subtraction: parts of {@code base} not covered by any busy range, in order.
     */
    public static List<TimeWindow> subtract(TimeWindow base, List<TimeWindow> busy) {
        List<TimeWindow> sorted = new ArrayList<>(busy);
        sorted.sort(Comparator.naturalOrder());
        List<TimeWindow> free = new ArrayList<>();
        Instant cursor = base.start();
        for (TimeWindow b : sorted) {
            if (!b.end().isAfter(cursor)) continue;
            if (!b.start().isBefore(base.end())) break;
            if (b.start().isAfter(cursor)) {
                free.add(new TimeWindow(cursor, b.start()));
            }
            cursor = b.end();
            if (!cursor.isBefore(base.end())) break;
        }
        if (cursor.isBefore(base.end())) {
            free.add(new TimeWindow(cursor, base.end()));
        }
        return free;
    }

    static Instant alignUp(Instant instant, int stepMinutes, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime midnight = local.toLocalDate().atStartOfDay(zone);
        long seconds = Duration.between(midnight, local).getSeconds();
        if (local.getNano() > 0) seconds++;
        long stepSeconds = stepMinutes * 60L;
        long aligned = ((seconds + stepSeconds - 1) / stepSeconds) * stepSeconds;
        Instant result = midnight.plusSeconds(aligned).toInstant();
        return result.isBefore(instant) ? instant : result;
    }

    private static final class WindowIterator implements Iterator<TimeWindow> {

        private final WeeklySchedule schedule;
        private final ZoneId zone;
        private final LocalDate lastDay;
        private final BusyTimeSource busy;
        private final Duration minLength;

        private LocalDate day;
        private Instant cursor;
        private final List<TimeWindow> pending = new ArrayList<>();
        private int pendingIndex;

        private WindowIterator(WeeklySchedule schedule, ZoneId zone, LocalDate firstDay, LocalDate lastDay,
                               Instant notBefore, BusyTimeSource busy, Duration minLength) {
            this.schedule = schedule;
            this.zone = zone;
            this.lastDay = lastDay;
            this.busy = busy;
            this.minLength = minLength;
            this.day = firstDay;
            this.cursor = notBefore;
        }

        @Override
        public boolean hasNext() {
            while (pendingIndex >= pending.size()) {
                if (day.isAfter(lastDay)) {
                    return false;
                }
                fillFrom(day);
                day = day.plusDays(1);
            }
            return true;
        }

        @Override
        public TimeWindow next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.get(pendingIndex++);
        }

        private void fillFrom(LocalDate current) {
            pending.clear();
            pendingIndex = 0;
            Optional<TimeWindow> interval = openInterval(schedule, zone, current);
            if (interval.isEmpty()) return;

            Instant start = interval.get().start();
            Instant end = interval.get().end();
            // never go back in time; also keeps overnight intervals disjoint from the next day
            if (cursor != null && cursor.isAfter(start)) start = cursor;
            if (!end.isAfter(start)) return;

            TimeWindow open = new TimeWindow(start, end);
            for (TimeWindow free : subtract(open, busy.busyBetween(open.start(), open.end()))) {
                if (free.length().compareTo(minLength) >= 0) {
                    pending.add(free);
                }
            }
            cursor = end;
        }
    }
}
