package com.ai.bookingbot.repository;

import com.ai.bookingbot.entity.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    List<ConversationMessage> findBySessionIdOrderByIdAsc(Long sessionId);

    long countBySessionId(Long sessionId);

    @Query("SELECT m.id FROM ConversationMessage m WHERE m.sessionId = :sessionId ORDER BY m.id ASC")
    List<Long> findIdsBySessionIdOldestFirst(@Param("sessionId") Long sessionId);

    @Modifying
    @Query("DELETE FROM ConversationMessage m WHERE m.id IN :ids")
    void deleteByIdIn(@Param("ids") List<Long> ids);
}
