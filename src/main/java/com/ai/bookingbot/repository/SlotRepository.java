package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.Slot;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface SlotRepository extends JpaRepository<Slot, Long> {

    @EntityGraph(attributePaths = "provider")
    Optional<Slot> findWithProviderById(Long id);

    List<Slot> findByProviderIdAndActiveTrueOrderByIdAsc(Long providerId);

    @EntityGraph(attributePaths = "provider")
    Optional<Slot> findFirstByWhatsappNumberAndActiveTrue(String whatsappNumber);

    /**
     * Per-slot commit boundary: concurrent booking attempts on the same slot queue here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Slot s WHERE s.id = :id")
    Optional<Slot> findByIdForUpdate(@Param("id") Long id);
}
