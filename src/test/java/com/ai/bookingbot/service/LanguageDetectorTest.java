package com.ai.bookingbot.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageDetector")
class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    @DisplayName("French and English messages are told apart")
    void detects() {
        assertThat(detector.detect("Bonjour, je voudrais un rendez-vous demain")).contains(LanguageDetector.FRENCH);
        assertThat(detector.detect("Hello, I would like to book an appointment")).contains(LanguageDetector.ENGLISH);
    }

    @Test
    @DisplayName("numbers and neutral words say nothing about the language")
    void neutral() {
        assertThat(detector.detect("2")).isEmpty();
        assertThat(detector.detect("ok")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }
}
