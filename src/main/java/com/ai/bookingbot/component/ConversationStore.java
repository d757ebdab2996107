package com.ai.bookingbot.component;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.conversation.ChatMessage;
import com.ai.bookingbot.entity.ConversationMessage;
import com.ai.bookingbot.repository.ConversationMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DB-backed, append-only chat history of a session. Once the history grows past the
 * configured cap the oldest messages are evicted.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    static final int MAX_CONTENT_LENGTH = 4000;

    private final ConversationMessageRepository repository;
    private final BookingProperties properties;
    private final Clock clock;

    public ConversationStore(ConversationMessageRepository repository, BookingProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> getHistory(Long sessionId) {
        if (sessionId == null) return Collections.emptyList();
        return repository.findBySessionIdOrderByIdAsc(sessionId).stream()
                .map(m -> new ChatMessage(m.getRole(), m.getContent()))
                .collect(Collectors.toList());
    }

    @Transactional
    public void appendUser(Long sessionId, String text) {
        append(sessionId, "user", text);
    }

    @Transactional
    public void appendAssistant(Long sessionId, String text) {
        append(sessionId, "assistant", text);
    }

    private void append(Long sessionId, String role, String content) {
        if (sessionId == null || content == null) return;
        ConversationMessage msg = ConversationMessage.builder()
                .sessionId(sessionId)
                .role(role)
                .content(content.length() > MAX_CONTENT_LENGTH ? content.substring(0, MAX_CONTENT_LENGTH) : content)
                .createdAt(clock.instant())
                .build();
        repository.save(msg);
        log.debug("[session {}] {} message stored ({} chars)", sessionId, role, content.length());
        evictOverflow(sessionId);
    }

    private void evictOverflow(Long sessionId) {
        int cap = Math.max(1, properties.getHistoryCap());
        long count = repository.countBySessionId(sessionId);
        if (count <= cap) return;
        List<Long> ids = repository.findIdsBySessionIdOldestFirst(sessionId);
        List<Long> evicted = new ArrayList<>(ids.subList(0, (int) Math.min(ids.size(), count - cap)));
        repository.deleteByIdIn(evicted);
        log.debug("[session {}] evicted {} old messages", sessionId, evicted.size());
    }
}
