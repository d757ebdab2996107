package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.PricingTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PricingTierRepository extends JpaRepository<PricingTier, Long> {

    List<PricingTier> findBySlotIdOrderByDurationMinutesAsc(Long slotId);

    List<PricingTier> findByProviderIdAndSlotIsNullOrderByDurationMinutesAsc(Long providerId);
}
