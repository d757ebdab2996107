package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * An individually bookable identity under a provider (one agent, one WhatsApp number).
 * Not to be confused with a calendar time slot.
 */
@Entity
@Table(name = "slot", indexes = {
    @Index(name = "idx_slot_provider", columnList = "provider_id"),
    @Index(name = "idx_slot_whatsapp", columnList = "whatsapp_number")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Slot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id", nullable = false)
    private Provider provider;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "contact_phone", length = 30)
    private String contactPhone;

    @Column(name = "whatsapp_number", length = 30)
    private String whatsappNumber;

    @Column(name = "approximate_address", length = 255)
    private String approximateAddress;

    /** Disclosed to the client only with the reminder shortly before the appointment. */
    @Column(name = "exact_address", length = 255)
    private String exactAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "availability_mode", nullable = false, length = 10)
    @Builder.Default
    private AvailabilityMode availabilityMode = AvailabilityMode.ACTIVE;

    @Column(name = "manual_override_until")
    private Instant manualOverrideUntil;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Version
    private Long version;
}
