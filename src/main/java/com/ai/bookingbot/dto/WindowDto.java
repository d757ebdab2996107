package com.ai.bookingbot.dto;

import com.ai.bookingbot.calendar.TimeWindow;

import java.time.Instant;

public record WindowDto(Instant start, Instant end) {

    public static WindowDto from(TimeWindow window) {
        return new WindowDto(window.start(), window.end());
    }
}
