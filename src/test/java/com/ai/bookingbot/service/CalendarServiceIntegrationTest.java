package com.ai.bookingbot.service;

import com.ai.bookingbot.IntegrationTestSupport;
import com.ai.bookingbot.calendar.TimeWindow;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.BlockedRange;
import com.ai.bookingbot.entity.BusinessHours;
import com.ai.bookingbot.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CalendarService")
class CalendarServiceIntegrationTest extends IntegrationTestSupport {

    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 19);

    @Autowired
    private CalendarService calendarService;
    @Autowired
    private SlotConfigurationService slotConfigurationService;

    @Test
    @DisplayName("confirmed appointments and blocked ranges are busy, cancelled ones are not")
    void windowsAroundBusyTime() {
        // given
        appointment("2026-10-19T10:00:00Z", 60, Appointment.Status.CONFIRMED);
        appointment("2026-10-19T12:00:00Z", 60, Appointment.Status.CANCELLED);
        blockedRangeRepository.save(BlockedRange.builder()
                .provider(provider)
                .startTime(Instant.parse("2026-10-19T14:00:00Z"))
                .endTime(Instant.parse("2026-10-19T15:00:00Z"))
                .build());

        // when
        List<TimeWindow> windows = calendarService.computeAvailableWindows(
                slotConfigurationService.requireSlot(slot.getId()), MONDAY, MONDAY, 60, MONDAY_8AM);

        // then
        assertThat(windows).containsExactly(
                window("2026-10-19T09:00:00Z", "2026-10-19T10:00:00Z"),
                window("2026-10-19T11:00:00Z", "2026-10-19T14:00:00Z"),
                window("2026-10-19T15:00:00Z", "2026-10-19T17:00:00Z"));
    }

    @Test
    @DisplayName("slot hours replace the provider hours")
    void slotHoursOverrideProvider() {
        // given
        businessHoursRepository.save(BusinessHours.builder()
                .provider(provider)
                .slot(slot)
                .dayOfWeek(1)
                .openTime(LocalTime.of(18, 0))
                .closeTime(LocalTime.of(1, 0))
                .build());

        // when
        List<TimeWindow> windows = calendarService.computeAvailableWindows(
                slotConfigurationService.requireSlot(slot.getId()), MONDAY, MONDAY.plusDays(1), 60, MONDAY_8AM);

        // then
        assertThat(windows).containsExactly(window("2026-10-19T18:00:00Z", "2026-10-20T01:00:00Z"));
    }

    @Test
    @DisplayName("nothing is returned before now")
    void startsAtNow() {
        // when
        List<TimeWindow> windows = calendarService.computeAvailableWindows(
                slotConfigurationService.requireSlot(slot.getId()), MONDAY, MONDAY, 30,
                Instant.parse("2026-10-19T16:00:00Z"));

        // then
        assertThat(windows).containsExactly(window("2026-10-19T16:00:00Z", "2026-10-19T17:00:00Z"));
    }

    @Test
    @DisplayName("durations outside 1..1440 minutes are rejected")
    void invalidDuration() {
        assertThatThrownBy(() -> calendarService.computeAvailableWindows(
                slotConfigurationService.requireSlot(slot.getId()), MONDAY, MONDAY, 0, MONDAY_8AM))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> calendarService.computeAvailableWindows(
                slotConfigurationService.requireSlot(slot.getId()), MONDAY, MONDAY, 1441, MONDAY_8AM))
                .isInstanceOf(ValidationException.class);
    }

    private void appointment(String start, int minutes, Appointment.Status status) {
        Instant s = Instant.parse(start);
        appointmentRepository.save(Appointment.builder()
                .slot(slot)
                .clientPhone("32470000000")
                .startTime(s)
                .endTime(s.plusSeconds(minutes * 60L))
                .durationMinutes(minutes)
                .status(status)
                .build());
    }

    private static TimeWindow window(String start, String end) {
        return new TimeWindow(Instant.parse(start), Instant.parse(end));
    }
}
