package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.BlacklistEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BlacklistEntryRepository extends JpaRepository<BlacklistEntry, Long> {

    Optional<BlacklistEntry> findByPhone(String phone);

    boolean existsByPhone(String phone);
}
