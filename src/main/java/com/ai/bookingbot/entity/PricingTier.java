package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Price for a (duration, category) pair. Rows without slot are provider defaults.
 */
@Entity
@Table(name = "pricing_tier", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"provider_id", "slot_id", "duration_minutes", "category"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PricingTier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id", nullable = false)
    private Provider provider;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "slot_id")
    private Slot slot;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private PricingCategory category;

    @Column(name = "price_minor", nullable = false)
    private long priceMinor;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
