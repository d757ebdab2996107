package com.ai.bookingbot.entity.converter;

import com.ai.bookingbot.conversation.SelectionMapping;
import com.ai.bookingbot.conversation.SessionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SelectionMappingConverter")
class SelectionMappingConverterTest {

    private final SelectionMappingConverter converter = new SelectionMappingConverter();

    @Test
    @DisplayName("a stored mapping reads back with its state, generation and order")
    void storesMapping() {
        // given
        Map<Integer, String> options = new LinkedHashMap<>();
        options.put(1, "2026-10-19T09:00:00Z");
        options.put(2, "2026-10-19T09:30:00Z");
        SelectionMapping mapping = new SelectionMapping(SessionState.AWAITING_SLOT_CHOICE, 6,
                Instant.parse("2026-10-19T08:00:00Z"), options);

        // when
        String column = converter.convertToDatabaseColumn(mapping);
        SelectionMapping read = converter.convertToEntityAttribute(column);

        // then
        assertThat(column).contains("2026-10-19T08:00:00Z").doesNotContain("\"empty\"");
        assertThat(read).isEqualTo(mapping);
        assertThat(read.isValidFor(SessionState.AWAITING_SLOT_CHOICE, 6)).isTrue();
        assertThat(read.isValidFor(SessionState.AWAITING_SLOT_CHOICE, 7)).isFalse();
        assertThat(read.options().keySet()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("null and blank columns mean no mapping")
    void nullColumns() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
        assertThat(converter.convertToEntityAttribute(" ")).isNull();
    }
}
