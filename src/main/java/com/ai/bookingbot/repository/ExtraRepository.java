package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.Extra;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExtraRepository extends JpaRepository<Extra, Long> {

    List<Extra> findByProviderIdOrderByCustomAscIdAsc(Long providerId);
}
