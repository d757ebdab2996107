package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Shared across providers: clients reported for no-shows.
 */
@Entity
@Table(name = "blacklist", indexes = {
    @Index(name = "idx_blacklist_phone", columnList = "phone", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlacklistEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Normalized phone: digits only. */
    @Column(nullable = false, length = 30)
    private String phone;

    @Column(name = "reported_by", nullable = false)
    private Long reportedBy;

    @Column(length = 255)
    private String reason;

    @Column(name = "report_count", nullable = false)
    @Builder.Default
    private int reportCount = 1;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
