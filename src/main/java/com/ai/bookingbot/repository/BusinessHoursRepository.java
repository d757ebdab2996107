package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.BusinessHours;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BusinessHoursRepository extends JpaRepository<BusinessHours, Long> {

    List<BusinessHours> findBySlotIdOrderByDayOfWeekAsc(Long slotId);

    List<BusinessHours> findByProviderIdAndSlotIsNullOrderByDayOfWeekAsc(Long providerId);
}
