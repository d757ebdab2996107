package com.ai.bookingbot.controller;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.dto.WindowDto;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.service.CalendarService;
import com.ai.bookingbot.service.SlotConfigurationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/slots")
public class AvailabilityController {

    private final SlotConfigurationService configuration;
    private final CalendarService calendarService;
    private final BookingProperties properties;
    private final Clock clock;

    public AvailabilityController(SlotConfigurationService configuration,
                                  CalendarService calendarService,
                                  BookingProperties properties,
                                  Clock clock) {
        this.configuration = configuration;
        this.calendarService = calendarService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Free windows able to hold {@code duration} minutes. Defaults to today through the search horizon.
     */
    @GetMapping("/{slotId}/availability")
    public List<WindowDto> availability(@PathVariable Long slotId,
                                        @RequestParam int duration,
                                        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Slot slot = configuration.requireSlot(slotId);
        Instant now = clock.instant();
        LocalDate first = from != null ? from : now.atZone(configuration.zoneOf(slot)).toLocalDate();
        LocalDate last = to != null ? to : first.plusDays(properties.getSearchHorizonDays());
        return calendarService.computeAvailableWindows(slot, first, last, duration, now).stream()
                .map(WindowDto::from)
                .collect(Collectors.toList());
    }
}
