package com.ai.bookingbot.service;

import com.ai.bookingbot.conversation.YesNoResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("YesNoClassifier")
class YesNoClassifierTest {

    private final YesNoClassifier classifier = new YesNoClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"oui", "Oui !", "ok", "d’accord", "je confirme", "yes please", "c'est bon pour moi"})
    @DisplayName("affirmative answers")
    void affirmative(String input) {
        assertThat(classifier.classify(input)).isEqualTo(YesNoResult.YES);
    }

    @ParameterizedTest
    @ValueSource(strings = {"non", "Non merci", "nope", "plus tard", "un autre horaire"})
    @DisplayName("negative answers")
    void negative(String input) {
        assertThat(classifier.classify(input)).isEqualTo(YesNoResult.NO);
    }

    @Test
    @DisplayName("mixed or empty answers are unknown")
    void unknown() {
        assertThat(classifier.classify("oui mais non")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify("peut-être")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify("   ")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(YesNoResult.UNKNOWN);
    }
}
