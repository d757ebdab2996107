package com.ai.bookingbot.service;

import com.ai.bookingbot.IntegrationTestSupport;
import com.ai.bookingbot.component.ConversationStore;
import com.ai.bookingbot.component.ResponsePhrases;
import com.ai.bookingbot.conversation.InboundMessage;
import com.ai.bookingbot.conversation.SelectionMapping;
import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.dto.TurnReply;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.AvailabilityMode;
import com.ai.bookingbot.entity.ClientBlock;
import com.ai.bookingbot.entity.ConversationSession;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.exception.PricingError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConversationService end to end")
class ConversationServiceIntegrationTest extends IntegrationTestSupport {

    private static final String LANG = "fr";
    private static final String ALICE = "+32 470 11 11 11";
    private static final String BOB = "+32 470 22 22 22";

    @Autowired
    private ConversationService conversationService;
    @Autowired
    private SessionStore sessionStore;
    @Autowired
    private SlotConfigurationService slotConfigurationService;
    @Autowired
    private ConversationStore conversationStore;
    @Autowired
    private ResponsePhrases phrases;

    @Test
    @DisplayName("a client books private one hour with an extra")
    void happyPath() {
        // given
        TurnReply reply = send(ALICE, "Bonjour");
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_CATEGORY);
        assertThat(reply.text()).contains(phrases.categoryLabel(LANG, PricingCategory.PRIVATE));

        assertThat(send(ALICE, "1").state()).isEqualTo(SessionState.AWAITING_DURATION);
        assertThat(send(ALICE, "2").state()).isEqualTo(SessionState.AWAITING_EXTRAS);

        reply = send(ALICE, "+1");
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_EXTRAS);
        assertThat(reply.text()).contains(ResponsePhrases.formatPrice(16000));

        reply = send(ALICE, "0");
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_SLOT_CHOICE);
        assertThat(mapping(reply).resolve(1)).isEqualTo("2026-10-19T09:00:00Z");

        assertThat(send(ALICE, "1").state()).isEqualTo(SessionState.AWAITING_CONFIRMATION);

        // when
        reply = send(ALICE, "oui");

        // then
        assertThat(reply.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(reply.appointmentId()).isNotNull();
        Appointment appointment = appointmentRepository.findById(reply.appointmentId()).orElseThrow();
        assertThat(appointment.getStartTime()).isEqualTo(Instant.parse("2026-10-19T09:00:00Z"));
        assertThat(appointment.getEndTime()).isEqualTo(Instant.parse("2026-10-19T10:00:00Z"));
        assertThat(appointment.getCategory()).isEqualTo(PricingCategory.PRIVATE);
        assertThat(appointment.getTotalPriceMinor()).isEqualTo(16000L);
        assertThat(appointment.getClientPhone()).isEqualTo("32470111111");
        assertThat(appointment.getSessionId()).isEqualTo(reply.sessionId());
        assertThat(appointment.getNotes()).contains("Massage");
        assertThat(conversationStore.getHistory(reply.sessionId())).hasSize(14);
    }

    @Test
    @DisplayName("the second client to confirm the same time gets fresh times")
    void losingClientIsOfferedFreshTimes() {
        // given
        driveToConfirmation(ALICE);
        driveToConfirmation(BOB);
        assertThat(send(ALICE, "oui").state()).isEqualTo(SessionState.COMPLETED);

        // when
        TurnReply reply = send(BOB, "oui");

        // then
        assertThat(reply.text()).contains(phrases.slotTaken(LANG));
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_SLOT_CHOICE);
        assertThat(mapping(reply).resolve(1)).isEqualTo("2026-10-19T10:00:00Z");
        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("an idle session expires and the next message starts over")
    void idleSessionExpires() {
        // given
        TurnReply first = send(ALICE, "Bonjour");
        send(ALICE, "1");
        advance(Duration.ofMinutes(31));
        assertThat(sessionStore.listActive(provider.getId(), now.get())).isEmpty();

        // when
        TurnReply reply = send(ALICE, "2");

        // then
        assertThat(reply.sessionId()).isNotEqualTo(first.sessionId());
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_CATEGORY);
        assertThat(reply.text()).contains(phrases.previousSessionExpired(LANG));
        assertThat(sessionRepository.findById(first.sessionId()).orElseThrow().getState()).isEqualTo(SessionState.EXPIRED);
        assertThat(sessionStore.listActive(provider.getId(), now.get()))
                .extracting(ConversationSession::getId)
                .containsExactly(reply.sessionId());
    }

    @Test
    @DisplayName("a time list older than its lifetime is re-issued")
    void staleTimeList() {
        // given
        driveToSlotChoice(ALICE);
        TurnReply before = send(ALICE, "autre chose");
        SelectionMapping old = mapping(before);
        advance(Duration.ofMinutes(16));

        // when
        TurnReply reply = send(ALICE, "1");

        // then
        assertThat(reply.text()).contains(phrases.listOutdated(LANG));
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_SLOT_CHOICE);
        SelectionMapping fresh = mapping(reply);
        assertThat(fresh.generation()).isGreaterThan(old.generation());
        assertThat(fresh.issuedAt()).isEqualTo(now.get());
    }

    @Test
    @DisplayName("a number typed at confirmation does not reach an older list")
    void numberDuringConfirmation() {
        // given
        driveToConfirmation(ALICE);

        // when
        TurnReply reply = send(ALICE, "2");

        // then
        assertThat(reply.text()).contains(phrases.listOutdated(LANG));
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_CONFIRMATION);
        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    @DisplayName("cancel ends the session and the next message starts fresh")
    void cancel() {
        // given
        send(ALICE, "Bonjour");
        send(ALICE, "1");

        // when
        TurnReply reply = send(ALICE, "annuler");

        // then
        assertThat(reply.state()).isEqualTo(SessionState.CANCELLED);
        assertThat(reply.text()).contains(phrases.cancelled(LANG));

        TurnReply next = send(ALICE, "Bonjour");
        assertThat(next.sessionId()).isNotEqualTo(reply.sessionId());
        assertThat(next.text()).doesNotContain(phrases.previousSessionExpired(LANG));
    }

    @Test
    @DisplayName("outcall below one hour is refused and the durations are shown again")
    void outcallUnderOneHour() {
        // given
        send(ALICE, "Bonjour");
        assertThat(send(ALICE, "2").state()).isEqualTo(SessionState.AWAITING_DURATION);

        // when
        TurnReply reply = send(ALICE, "45");

        // then
        assertThat(reply.text()).contains(phrases.pricingError(LANG, PricingError.CATEGORY_UNAVAILABLE_FOR_DURATION));
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_DURATION);
        assertThat(mapping(reply).options()).containsOnlyKeys(1);
        assertThat(mapping(reply).resolve(1)).isEqualTo("60");
    }

    @Test
    @DisplayName("back from extras returns to the durations")
    void backNavigation() {
        // given
        send(ALICE, "Bonjour");
        send(ALICE, "1");
        send(ALICE, "2");

        // when
        TurnReply reply = send(ALICE, "retour");

        // then
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_DURATION);
    }

    @Test
    @DisplayName("ghost mode offers no times")
    void ghostMode() {
        // given
        slotConfigurationService.updateAvailabilityMode(slot.getId(), AvailabilityMode.GHOST);

        // when
        TurnReply reply = driveToSlotChoice(ALICE);

        // then
        assertThat(reply.text()).contains(phrases.noAvailability(LANG));
        assertThat(mapping(reply).isEmpty()).isTrue();
        assertThat(send(ALICE, "1").state()).isEqualTo(SessionState.AWAITING_SLOT_CHOICE);
        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    @DisplayName("away mode tells the next free times without a numbered list")
    void awayMode() {
        // given
        slotConfigurationService.updateAvailabilityMode(slot.getId(), AvailabilityMode.AWAY);

        // when
        TurnReply reply = driveToSlotChoice(ALICE);

        // then
        assertThat(reply.text()).contains(phrases.formatStart(LANG, Instant.parse("2026-10-19T09:00:00Z"), ZoneOffset.UTC));
        assertThat(mapping(reply).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("a client blocked by the provider gets no reply")
    void blockedClient() {
        // given
        clientBlockRepository.save(ClientBlock.builder().providerId(provider.getId()).phone("32470111111").build());

        // when
        TurnReply reply = send(ALICE, "Bonjour");

        // then
        assertThat(reply.silent()).isTrue();
        assertThat(sessionRepository.count()).isZero();
    }

    @Test
    @DisplayName("asking for help mid-conversation repeats the current step")
    void helpRepromptsCurrentStep() {
        // given
        send(ALICE, "Bonjour");
        assertThat(send(ALICE, "1").state()).isEqualTo(SessionState.AWAITING_DURATION);

        // when
        TurnReply reply = send(ALICE, "aide");

        // then
        assertThat(reply.state()).isEqualTo(SessionState.AWAITING_DURATION);
        assertThat(reply.text())
                .contains(phrases.help(LANG))
                .contains(phrases.durationOption(60, 13000L));
        assertThat(mapping(reply).resolve(2)).isEqualTo("60");
    }

    private TurnReply send(String phone, String body) {
        return conversationService.handleTurn(new InboundMessage(provider.getId(), slot.getId(), phone, body));
    }

    private TurnReply driveToSlotChoice(String phone) {
        send(phone, "Bonjour");
        send(phone, "1");
        send(phone, "2");
        return send(phone, "0");
    }

    private void driveToConfirmation(String phone) {
        driveToSlotChoice(phone);
        assertThat(send(phone, "1").state()).isEqualTo(SessionState.AWAITING_CONFIRMATION);
    }

    private SelectionMapping mapping(TurnReply reply) {
        return sessionRepository.findById(reply.sessionId()).orElseThrow().getSelectionMapping();
    }
}
