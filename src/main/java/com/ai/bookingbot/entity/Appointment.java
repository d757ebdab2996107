package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_slot_start", columnList = "slot_id, start_time"),
    @Index(name = "idx_appointment_client_phone", columnList = "client_phone")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status { CONFIRMED, CANCELLED, COMPLETED, NO_SHOW }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "slot_id", nullable = false)
    private Slot slot;

    /** Optional service reference; booking and conflict logic never depend on it. */
    @Column(name = "service_ref", length = 100)
    private String serviceRef;

    /** Conversation that produced this appointment, if any. */
    @Column(name = "session_id")
    private Long sessionId;

    @Column(name = "client_phone", nullable = false, length = 30)
    private String clientPhone;

    @Column(name = "client_name", length = 100)
    private String clientName;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    /** Denormalized start + duration, kept for range scans. */
    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private PricingCategory category;

    @Column(name = "total_price_minor")
    private Long totalPriceMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    @Builder.Default
    private Status status = Status.CONFIRMED;

    @Column(name = "reminder_sent", nullable = false)
    private boolean reminderSent;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (endTime == null && startTime != null) endTime = startTime.plusSeconds(durationMinutes * 60L);
    }

    public boolean isBlocking() {
        return status != Status.CANCELLED;
    }
}
