package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.BlockedRange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface BlockedRangeRepository extends JpaRepository<BlockedRange, Long> {

    /**
     * Ranges intersecting [from, to) that apply to the slot, including provider-wide ranges.
     */
    @Query("SELECT b FROM BlockedRange b WHERE b.provider.id = :providerId "
            + "AND (b.slot IS NULL OR b.slot.id = :slotId) "
            + "AND b.startTime < :to AND b.endTime > :from "
            + "ORDER BY b.startTime ASC")
    List<BlockedRange> findIntersecting(@Param("providerId") Long providerId,
                                        @Param("slotId") Long slotId,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);
}
