package com.ai.bookingbot.service;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.AvailabilityMode;
import com.ai.bookingbot.entity.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityGate")
class AvailabilityGateTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
    private static final String PHONE = "32470000000";

    @Mock
    private ClientSafetyService clientSafetyService;

    private BookingProperties properties;
    private AvailabilityGate gate;

    @BeforeEach
    void setUp() {
        properties = new BookingProperties();
        gate = new AvailabilityGate(clientSafetyService, properties);
    }

    @Test
    @DisplayName("an active slot without override may auto book")
    void activeSlot() {
        // given
        given(clientSafetyService.isBlacklisted(PHONE)).willReturn(false);

        // when
        GateDecision decision = gate.canAutoBook(slot(AvailabilityMode.ACTIVE, null), PHONE, NOW);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo(GateDecision.Reason.ACTIVE);
    }

    @Test
    @DisplayName("a running manual override blocks even an active slot")
    void manualOverrideWins() {
        // when
        GateDecision decision = gate.canAutoBook(slot(AvailabilityMode.ACTIVE, NOW.plusSeconds(3600)), PHONE, NOW);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(GateDecision.Reason.MANUAL_OVERRIDE);
        verifyNoInteractions(clientSafetyService);
    }

    @Test
    @DisplayName("an elapsed override no longer applies")
    void elapsedOverride() {
        GateDecision decision = gate.canAutoBook(slot(AvailabilityMode.ACTIVE, NOW.minusSeconds(1)), NOW);

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    @DisplayName("ghost and away modes refuse auto booking")
    void ghostAndAway() {
        assertThat(gate.canAutoBook(slot(AvailabilityMode.GHOST, null), NOW).reason())
                .isEqualTo(GateDecision.Reason.GHOST);
        assertThat(gate.canAutoBook(slot(AvailabilityMode.AWAY, null), NOW).reason())
                .isEqualTo(GateDecision.Reason.AWAY);
    }

    @Test
    @DisplayName("away may still show the next free times when configured")
    void awayShowsNextAvailable() {
        GateDecision away = gate.canAutoBook(slot(AvailabilityMode.AWAY, null), NOW);
        GateDecision ghost = gate.canAutoBook(slot(AvailabilityMode.GHOST, null), NOW);

        assertThat(gate.mayShowNextAvailable(away)).isTrue();
        assertThat(gate.mayShowNextAvailable(ghost)).isFalse();

        properties.setAwayShowsNextAvailable(false);
        assertThat(gate.mayShowNextAvailable(away)).isFalse();
    }

    @Test
    @DisplayName("a blacklisted client is flagged for manual follow-up")
    void blacklistedClient() {
        // given
        given(clientSafetyService.isBlacklisted(PHONE)).willReturn(true);

        // when
        GateDecision decision = gate.canAutoBook(slot(AvailabilityMode.ACTIVE, null), PHONE, NOW);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(GateDecision.Reason.CLIENT_FLAGGED);
    }

    private Slot slot(AvailabilityMode mode, Instant overrideUntil) {
        return Slot.builder().id(1L).name("Demo").availabilityMode(mode).manualOverrideUntil(overrideUntil).build();
    }
}
