package com.ai.bookingbot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "extra", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"provider_id", "name"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Extra {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id", nullable = false)
    private Provider provider;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "price_minor", nullable = false)
    private long priceMinor;

    /** False for the predefined catalogue, true for extras the provider named. */
    @Column(nullable = false)
    private boolean custom;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
