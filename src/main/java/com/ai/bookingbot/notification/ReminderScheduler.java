package com.ai.bookingbot.notification;

import com.ai.bookingbot.component.ResponsePhrases;
import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.ConversationSession;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.repository.AppointmentRepository;
import com.ai.bookingbot.service.LanguageDetector;
import com.ai.bookingbot.service.SessionStore;
import com.ai.bookingbot.service.SlotConfigurationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Sends the pre-appointment reminder, which is where the exact address is disclosed.
 */
@Component
@ConditionalOnProperty(name = "booking.reminders.enabled", havingValue = "true")
public class ReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final AppointmentRepository appointmentRepository;
    private final SessionStore sessionStore;
    private final SlotConfigurationService configuration;
    private final ChatTransport chatTransport;
    private final ResponsePhrases phrases;
    private final BookingProperties properties;
    private final Clock clock;

    public ReminderScheduler(AppointmentRepository appointmentRepository,
                             SessionStore sessionStore,
                             SlotConfigurationService configuration,
                             ChatTransport chatTransport,
                             ResponsePhrases phrases,
                             BookingProperties properties,
                             Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.sessionStore = sessionStore;
        this.configuration = configuration;
        this.chatTransport = chatTransport;
        this.phrases = phrases;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${booking.reminders.interval-ms:300000}")
    @Transactional
    public void sendDueReminders() {
        Instant now = clock.instant();
        List<Appointment> due = appointmentRepository.findNeedingReminder(
                Appointment.Status.CONFIRMED, now, now.plus(properties.getReminders().getLead()));
        if (due.isEmpty()) return;

        int sent = 0;
        for (Appointment appointment : due) {
            Slot slot = appointment.getSlot();
            String lang = appointment.getSessionId() == null ? LanguageDetector.FRENCH
                    : sessionStore.findById(appointment.getSessionId())
                        .map(ConversationSession::getLanguage)
                        .orElse(LanguageDetector.FRENCH);
            String text = phrases.reminder(lang, appointment.getStartTime(), configuration.zoneOf(slot), slot.getExactAddress());
            if (chatTransport.send(slot.getWhatsappNumber(), appointment.getClientPhone(), text)) {
                appointment.setReminderSent(true);
                appointmentRepository.save(appointment);
                sent++;
            } else {
                log.warn("Reminder for appointment {} not delivered, will retry", appointment.getId());
            }
        }
        log.info("Reminders: {} due, {} sent", due.size(), sent);
    }
}
