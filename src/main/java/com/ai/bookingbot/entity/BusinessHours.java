package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

/**
 * Weekly opening hours. A row without slot is the provider default; a row with a slot
 * overrides the provider default for that slot.
 */
@Entity
@Table(name = "business_hours", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"provider_id", "slot_id", "day_of_week"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessHours {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id", nullable = false)
    private Provider provider;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "slot_id")
    private Slot slot;

    /**
     * Day of week: 0 = Sunday, 6 = Saturday.
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time", nullable = false)
    private LocalTime openTime;

    @Column(name = "close_time", nullable = false)
    private LocalTime closeTime;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;
}
