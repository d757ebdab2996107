package com.ai.bookingbot.service;

import com.ai.bookingbot.calendar.AvailabilityCalculator;
import com.ai.bookingbot.calendar.BusyTimeSource;
import com.ai.bookingbot.calendar.TimeWindow;
import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.BlockedRange;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.exception.ErrorCode;
import com.ai.bookingbot.exception.ValidationException;
import com.ai.bookingbot.repository.AppointmentRepository;
import com.ai.bookingbot.repository.BlockedRangeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage-backed face of the calendar model. Reads a snapshot of hours, appointments and
 * blocked ranges and delegates the computation to {@link AvailabilityCalculator}.
 */
@Service
public class CalendarService {

    static final int MAX_DURATION_MINUTES = 24 * 60;

    private static final Set<Appointment.Status> NON_BLOCKING = EnumSet.of(Appointment.Status.CANCELLED);

    private final SlotConfigurationService configuration;
    private final AppointmentRepository appointmentRepository;
    private final BlockedRangeRepository blockedRangeRepository;
    private final BookingProperties properties;

    public CalendarService(SlotConfigurationService configuration,
                           AppointmentRepository appointmentRepository,
                           BlockedRangeRepository blockedRangeRepository,
                           BookingProperties properties) {
        this.configuration = configuration;
        this.appointmentRepository = appointmentRepository;
        this.blockedRangeRepository = blockedRangeRepository;
        this.properties = properties;
    }

    /**
     * Free windows of the slot between {@code from} and {@code to} (inclusive days, slot time zone)
     * that can hold {@code durationMinutes}. Nothing is returned before {@code now} plus the lead time.
     */
    @Transactional(readOnly = true)
    public List<TimeWindow> computeAvailableWindows(Slot slot, LocalDate from, LocalDate to, int durationMinutes, Instant now) {
        validateDuration(durationMinutes);
        if (to.isBefore(from)) {
            throw new ValidationException("Date range end " + to + " is before start " + from);
        }
        ZoneId zone = configuration.zoneOf(slot);
        Instant rangeStart = from.atStartOfDay(zone).toInstant();
        Instant earliest = now.plus(properties.getMinimumLeadTime());
        Instant notBefore = earliest.isAfter(rangeStart) ? earliest : rangeStart;
        Instant rangeEnd = to.plusDays(1).atStartOfDay(zone).toInstant();
        // the day before may hold an interval running past midnight into the range
        try (Stream<TimeWindow> windows = availableWindows(slot, from.minusDays(1), to, durationMinutes, notBefore)) {
            return windows
                    .map(w -> w.end().isAfter(rangeEnd) ? clip(w, rangeEnd) : w)
                    .filter(w -> w != null && !w.length().minusMinutes(durationMinutes).isNegative())
                    .collect(Collectors.toList());
        }
    }

    /**
     * Next concrete start times, each exactly {@code durationMinutes} long, within the search horizon.
     */
    @Transactional(readOnly = true)
    public List<TimeWindow> nextOpenings(Slot slot, int durationMinutes, int limit, Instant now) {
        validateDuration(durationMinutes);
        ZoneId zone = configuration.zoneOf(slot);
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant notBefore = now.plus(properties.getMinimumLeadTime());
        try (Stream<TimeWindow> windows = availableWindows(slot, today.minusDays(1),
                today.plusDays(properties.getSearchHorizonDays()), durationMinutes, notBefore)) {
            return AvailabilityCalculator.openings(windows, durationMinutes, properties.getSlotGranularityMinutes(), zone)
                    .limit(limit)
                    .collect(Collectors.toList());
        }
    }

    /**
     * Lazy sequence over the slot's calendar. Must be consumed inside the caller's transaction.
     */
    public Stream<TimeWindow> availableWindows(Slot slot, LocalDate firstDay, LocalDate lastDay, int durationMinutes, Instant notBefore) {
        return AvailabilityCalculator.availableWindows(
                configuration.effectiveSchedule(slot),
                configuration.zoneOf(slot),
                firstDay,
                lastDay,
                notBefore,
                busyTimeSource(slot),
                durationMinutes);
    }

    /**
     * True when the proposal starts no earlier than {@code now} plus the lead time, inside open hours
     * and outside every blocked range. Overlap with appointments is checked separately.
     */
    @Transactional(readOnly = true)
    public boolean isStillOpen(Slot slot, TimeWindow proposal, Instant now) {
        if (proposal.start().isBefore(now.plus(properties.getMinimumLeadTime()))) return false;
        if (!AvailabilityCalculator.isWithinOpenHours(configuration.effectiveSchedule(slot), configuration.zoneOf(slot), proposal)) {
            return false;
        }
        return blockedRangeRepository.findIntersecting(slot.getProvider().getId(), slot.getId(),
                proposal.start(), proposal.end()).isEmpty();
    }

    @Transactional(readOnly = true)
    public boolean overlapsAppointment(Slot slot, TimeWindow proposal) {
        return !appointmentRepository.findIntersecting(slot.getId(), proposal.start(), proposal.end(), NON_BLOCKING).isEmpty();
    }

    static void validateDuration(int durationMinutes) {
        if (durationMinutes <= 0 || durationMinutes > MAX_DURATION_MINUTES) {
            throw new ValidationException(ErrorCode.INVALID_DURATION, "Invalid duration: " + durationMinutes + " minutes.");
        }
    }

    private BusyTimeSource busyTimeSource(Slot slot) {
        Long slotId = slot.getId();
        Long providerId = slot.getProvider().getId();
        return (from, to) -> {
            List<TimeWindow> busy = new ArrayList<>();
            for (Appointment a : appointmentRepository.findIntersecting(slotId, from, to, NON_BLOCKING)) {
                busy.add(new TimeWindow(a.getStartTime(), a.getEndTime()));
            }
            for (BlockedRange b : blockedRangeRepository.findIntersecting(providerId, slotId, from, to)) {
                if (b.getEndTime().isAfter(b.getStartTime())) {
                    busy.add(new TimeWindow(b.getStartTime(), b.getEndTime()));
                }
            }
            return busy;
        };
    }

    private static TimeWindow clip(TimeWindow window, Instant end) {
        return window.start().isBefore(end) ? new TimeWindow(window.start(), end) : null;
    }
}
