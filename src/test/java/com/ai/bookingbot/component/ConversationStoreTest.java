package com.ai.bookingbot.component;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.ConversationMessage;
import com.ai.bookingbot.repository.ConversationMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationStore")
class ConversationStoreTest {

    private static final Long SESSION_ID = 5L;

    @Mock
    private ConversationMessageRepository repository;

    private ConversationStore store;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.setHistoryCap(3);
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC);
        store = new ConversationStore(repository, properties, clock);
    }

    @Test
    @DisplayName("oldest messages are evicted above the cap")
    void evictsOldest() {
        // given
        given(repository.countBySessionId(SESSION_ID)).willReturn(5L);
        given(repository.findIdsBySessionIdOldestFirst(SESSION_ID)).willReturn(List.of(1L, 2L, 3L, 4L, 5L));

        // when
        store.appendUser(SESSION_ID, "bonjour");

        // then
        verify(repository).deleteByIdIn(List.of(1L, 2L));
    }

    @Test
    @DisplayName("nothing is evicted within the cap")
    void keepsHistoryWithinCap() {
        // given
        given(repository.countBySessionId(SESSION_ID)).willReturn(3L);

        // when
        store.appendAssistant(SESSION_ID, "Bienvenue");

        // then
        verify(repository, never()).deleteByIdIn(anyList());
    }

    @Test
    @DisplayName("overlong content is truncated")
    void truncatesContent() {
        // given
        given(repository.countBySessionId(SESSION_ID)).willReturn(1L);

        // when
        store.appendUser(SESSION_ID, "x".repeat(5000));

        // then
        ArgumentCaptor<ConversationMessage> captor = ArgumentCaptor.forClass(ConversationMessage.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getContent()).hasSize(ConversationStore.MAX_CONTENT_LENGTH);
        assertThat(captor.getValue().getRole()).isEqualTo("user");
        assertThat(captor.getValue().getCreatedAt()).isEqualTo(Instant.parse("2026-10-19T08:00:00Z"));
    }

    @Test
    @DisplayName("messages without a session are ignored")
    void ignoresMissingSession() {
        store.appendUser(null, "hello");

        verify(repository, never()).save(any(ConversationMessage.class));
        assertThat(store.getHistory(null)).isEmpty();
    }
}
