package com.ai.bookingbot.service;

import com.ai.bookingbot.calendar.TimeWindow;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.exception.ErrorCode;
import com.ai.bookingbot.exception.NotFoundException;
import com.ai.bookingbot.exception.RejectionReason;
import com.ai.bookingbot.exception.ValidationException;
import com.ai.bookingbot.repository.AppointmentRepository;
import com.ai.bookingbot.repository.SlotRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * The only way an appointment gets written. Each attempt locks its slot row, re-validates
 * against the committed state and inserts; the first valid commit wins.
 */
@Service
public class BookingArbiter {

    private static final Logger log = LoggerFactory.getLogger(BookingArbiter.class);

    private final SlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final CalendarService calendarService;
    private final AvailabilityGate availabilityGate;
    private final Clock clock;

    public BookingArbiter(SlotRepository slotRepository,
                          AppointmentRepository appointmentRepository,
                          CalendarService calendarService,
                          AvailabilityGate availabilityGate,
                          Clock clock) {
        this.slotRepository = slotRepository;
        this.appointmentRepository = appointmentRepository;
        this.calendarService = calendarService;
        this.availabilityGate = availabilityGate;
        this.clock = clock;
    }

    @Transactional
    public BookingResult commitAppointment(Long slotId, Instant proposedStart, int durationMinutes,
                                           String clientPhone, String serviceRef) {
        return commitAppointment(BookingRequest.builder()
                .slotId(slotId)
                .start(proposedStart)
                .durationMinutes(durationMinutes)
                .clientPhone(clientPhone)
                .serviceRef(serviceRef)
                .origin(BookingOrigin.BOT)
                .build());
    }

    @Transactional
    public BookingResult commitAppointment(BookingRequest request) {
        if (request.start() == null) throw new ValidationException("Start time is required.");
        if (StringUtils.isBlank(request.clientPhone())) throw new ValidationException("Client phone is required.");
        CalendarService.validateDuration(request.durationMinutes());

        // per-slot serialization point; other slots are not affected
        Slot slot = slotRepository.findByIdForUpdate(request.slotId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.SLOT_NOT_FOUND, request.slotId()));
        TimeWindow proposal = TimeWindow.ofMinutes(request.start(), request.durationMinutes());
        Instant now = clock.instant();

        if (calendarService.overlapsAppointment(slot, proposal)) {
            return reject(slot, proposal, request, RejectionReason.SLOT_TAKEN);
        }
        if (!calendarService.isStillOpen(slot, proposal, now)) {
            return reject(slot, proposal, request, RejectionReason.NO_LONGER_AVAILABLE);
        }
        BookingOrigin origin = request.origin() != null ? request.origin() : BookingOrigin.BOT;
        if (origin == BookingOrigin.BOT) {
            GateDecision decision = availabilityGate.canAutoBook(slot, request.clientPhone(), now);
            if (!decision.allowed()) {
                log.warn("Gate refused booking on slot {}: {}", slot.getId(), decision.reason());
                return reject(slot, proposal, request, RejectionReason.MODE_CLOSED);
            }
        }

        Appointment appointment = Appointment.builder()
                .slot(slot)
                .serviceRef(StringUtils.trimToNull(request.serviceRef()))
                .sessionId(request.sessionId())
                .clientPhone(request.clientPhone())
                .clientName(request.clientName())
                .startTime(proposal.start())
                .endTime(proposal.end())
                .durationMinutes(request.durationMinutes())
                .category(request.category())
                .totalPriceMinor(request.totalPriceMinor())
                .notes(request.notes())
                .status(Appointment.Status.CONFIRMED)
                .build();
        appointment = appointmentRepository.saveAndFlush(appointment);

        log.info("Booked appointment id={} slotId={} start={} duration={} client={} origin={}",
                appointment.getId(), slot.getId(), proposal.start(), request.durationMinutes(),
                request.clientPhone(), origin);
        return BookingResult.booked(appointment);
    }

    private BookingResult reject(Slot slot, TimeWindow proposal, BookingRequest request, RejectionReason reason) {
        log.warn("Booking rejected slotId={} start={} client={} reason={}",
                slot.getId(), proposal.start(), request.clientPhone(), reason);
        return BookingResult.rejected(reason);
    }
}
