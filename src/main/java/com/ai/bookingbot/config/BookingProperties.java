package com.ai.bookingbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the booking engine, bound from {@code booking.*}.
 */
@Data
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    /** A session idle longer than this is expired on its next access. */
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);

    /** Oldest messages are evicted once a session history exceeds this size. */
    private int historyCap = 50;

    /** Number of numbered times offered per prompt. */
    private int windowBatchSize = 8;

    /** How many days ahead availability is searched. */
    private int searchHorizonDays = 14;

    /** Offered start times are multiples of this after local midnight. */
    private int slotGranularityMinutes = 30;

    /** Earliest bookable start relative to now. */
    private Duration minimumLeadTime = Duration.ZERO;

    /** A numbered list of times is honoured for this long. */
    private Duration slotChoiceTtl = Duration.ofMinutes(15);

    /** In away mode, still tell the client the next free times (no auto booking). */
    private boolean awayShowsNextAvailable = true;

    private String defaultTimeZone = "Europe/Brussels";

    /** Load the demo provider on startup. */
    private boolean seedDemoData = false;

    private Reminders reminders = new Reminders();

    @Data
    public static class Reminders {

        private boolean enabled = false;

        /** Appointments starting within this lead get their reminder. */
        private Duration lead = Duration.ofMinutes(60);
    }
}
