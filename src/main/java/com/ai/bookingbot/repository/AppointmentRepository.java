package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /**
     * Appointments of one slot intersecting [from, to) whose status is not excluded.
     */
    @Query("SELECT a FROM Appointment a WHERE a.slot.id = :slotId "
            + "AND a.status NOT IN :excluded "
            + "AND a.startTime < :to AND a.endTime > :from "
            + "ORDER BY a.startTime ASC")
    List<Appointment> findIntersecting(@Param("slotId") Long slotId,
                                       @Param("from") Instant from,
                                       @Param("to") Instant to,
                                       @Param("excluded") Collection<Appointment.Status> excluded);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.slot s JOIN FETCH s.provider "
            + "WHERE a.status = :status AND a.reminderSent = false "
            + "AND a.startTime > :from AND a.startTime <= :to")
    List<Appointment> findNeedingReminder(@Param("status") Appointment.Status status,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    List<Appointment> findByClientPhoneAndStatusOrderByStartTimeAsc(String clientPhone, Appointment.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}
