package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.ClientBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClientBlockRepository extends JpaRepository<ClientBlock, Long> {

    boolean existsByProviderIdAndPhone(Long providerId, String phone);
}
