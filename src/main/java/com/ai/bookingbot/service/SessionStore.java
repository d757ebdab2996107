package com.ai.bookingbot.service;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.entity.ConversationSession;
import com.ai.bookingbot.repository.ConversationSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted session per (provider, client phone). Idle sessions are expired lazily, when
 * the pair writes again or when active sessions are listed.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final Set<SessionState> OPEN_STATES = EnumSet.of(
            SessionState.AWAITING_CATEGORY,
            SessionState.AWAITING_DURATION,
            SessionState.AWAITING_EXTRAS,
            SessionState.AWAITING_SLOT_CHOICE,
            SessionState.AWAITING_CONFIRMATION);

    private final ConversationSessionRepository repository;
    private final BookingProperties properties;

    public SessionStore(ConversationSessionRepository repository, BookingProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /**
     * Current open session of the pair, or a new one. An idle open session is marked
     * EXPIRED first and replaced.
     */
    @Transactional
    public SessionLookup open(Long providerId, String clientPhone, Long slotId, Instant now) {
        Optional<ConversationSession> latest = repository.findFirstByProviderIdAndClientPhoneOrderByIdDesc(providerId, clientPhone);
        boolean expired = false;
        if (latest.isPresent() && !latest.get().getState().isTerminal()) {
            ConversationSession session = latest.get();
            if (!session.isIdle(now, properties.getSessionIdleTimeout())) {
                return new SessionLookup(session, false, false);
            }
            expire(session);
            expired = true;
        }
        return new SessionLookup(createNew(providerId, clientPhone, slotId, now), true, expired);
    }

    @Transactional
    public ConversationSession createNew(Long providerId, String clientPhone, Long slotId, Instant now) {
        ConversationSession session = ConversationSession.builder()
                .providerId(providerId)
                .clientPhone(clientPhone)
                .slotId(slotId)
                .state(SessionState.AWAITING_CATEGORY)
                .lastUpdate(now)
                .createdAt(now)
                .build();
        session = repository.save(session);
        log.info("New conversation session id={} provider={} client={}", session.getId(), providerId, clientPhone);
        return session;
    }

    @Transactional
    public ConversationSession save(ConversationSession session, Instant now) {
        session.setLastUpdate(now);
        return repository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<ConversationSession> findById(Long sessionId) {
        return repository.findById(sessionId);
    }

    /**
     * Non-terminal sessions updated within the idle timeout, most recent first.
     */
    @Transactional(readOnly = true)
    public List<ConversationSession> listActive(Long providerId, Instant now) {
        return repository.findByProviderIdAndStateInAndLastUpdateAfterOrderByLastUpdateDesc(
                providerId, OPEN_STATES, now.minus(properties.getSessionIdleTimeout()));
    }

    private void expire(ConversationSession session) {
        SessionState previous = session.getState();
        session.setState(SessionState.EXPIRED);
        session.setSelectionMapping(null);
        repository.save(session);
        log.info("Session id={} expired in state {} (client={})", session.getId(), previous, session.getClientPhone());
    }

    public record SessionLookup(ConversationSession session, boolean created, boolean previousExpired) {
    }
}
