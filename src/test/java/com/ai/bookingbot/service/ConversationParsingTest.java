package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.PricingCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Conversation input parsing")
class ConversationParsingTest {

    @Test
    @DisplayName("numbers with an optional plus sign")
    void numbers() {
        assertThat(ConversationService.parseNumber(" 3 ")).isEqualTo(OptionalInt.of(3));
        assertThat(ConversationService.parseNumber("+2")).isEqualTo(OptionalInt.of(2));
        assertThat(ConversationService.parseNumber("90")).isEqualTo(OptionalInt.of(90));
        assertThat(ConversationService.parseNumber("deux")).isEmpty();
        assertThat(ConversationService.parseNumber("1 2")).isEmpty();
    }

    @Test
    @DisplayName("duration literals in hours and minutes")
    void durationLiterals() {
        assertThat(ConversationService.parseDurationLiteral("1h")).isEqualTo(60);
        assertThat(ConversationService.parseDurationLiteral("1h30")).isEqualTo(90);
        assertThat(ConversationService.parseDurationLiteral("2 heures")).isEqualTo(120);
        assertThat(ConversationService.parseDurationLiteral("45 min")).isEqualTo(45);
        assertThat(ConversationService.parseDurationLiteral("0h")).isNull();
        assertThat(ConversationService.parseDurationLiteral("longtemps")).isNull();
    }

    @Test
    @DisplayName("category keywords, ambiguous messages pick nothing")
    void categoryKeywords() {
        assertThat(ConversationService.categoryKeyword("en privé svp")).contains(PricingCategory.PRIVATE);
        assertThat(ConversationService.categoryKeyword("Outcall")).contains(PricingCategory.OUTCALL);
        assertThat(ConversationService.categoryKeyword("deplacement")).contains(PricingCategory.OUTCALL);
        assertThat(ConversationService.categoryKeyword("private or outcall")).isEmpty();
        assertThat(ConversationService.categoryKeyword("bonjour")).isEmpty();
    }
}
