package com.ai.bookingbot.repository;

import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.entity.ConversationSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationSessionRepository extends JpaRepository<ConversationSession, Long> {

    Optional<ConversationSession> findFirstByProviderIdAndClientPhoneOrderByIdDesc(Long providerId, String clientPhone);

    List<ConversationSession> findByProviderIdAndStateInAndLastUpdateAfterOrderByLastUpdateDesc(
            Long providerId, Collection<SessionState> states, Instant updatedAfter);
}
