package com.ai.bookingbot.entity;

import com.ai.bookingbot.conversation.SelectionMapping;
import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.entity.converter.SelectionMappingConverter;
import com.ai.bookingbot.entity.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable draft of one booking conversation for a (provider, client phone) pair.
 * Collections and the selection mapping are replaced, never mutated in place.
 */
@Entity
@Table(name = "conversation_session", indexes = {
    @Index(name = "idx_session_provider_phone", columnList = "provider_id, client_phone"),
    @Index(name = "idx_session_last_update", columnList = "last_update")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "client_phone", nullable = false, length = 30)
    private String clientPhone;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 25)
    @Builder.Default
    private SessionState state = SessionState.AWAITING_CATEGORY;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private PricingCategory category;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "base_price_minor", nullable = false)
    private long basePriceMinor;

    @Convert(converter = StringListConverter.class)
    @Column(name = "extras", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> extras = new ArrayList<>();

    @Column(name = "extras_total_minor", nullable = false)
    private long extrasTotalMinor;

    @Column(name = "selected_start")
    private Instant selectedStart;

    /** Bumped every time a new numbered list is shown. */
    @Column(nullable = false)
    private int generation;

    @Convert(converter = SelectionMappingConverter.class)
    @Column(name = "selection_mapping", columnDefinition = "TEXT")
    private SelectionMapping selectionMapping;

    @Column(length = 5)
    @Builder.Default
    private String language = "fr";

    @Column(name = "appointment_id")
    private Long appointmentId;

    @Column(name = "last_update", nullable = false)
    private Instant lastUpdate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (lastUpdate == null) lastUpdate = now;
    }

    public boolean isIdle(Instant now, Duration idleTimeout) {
        return lastUpdate != null && lastUpdate.plus(idleTimeout).isBefore(now);
    }

    public long getTotalPriceMinor() {
        return basePriceMinor + extrasTotalMinor;
    }
}
