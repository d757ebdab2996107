package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.exception.AvailabilityException;
import com.ai.bookingbot.exception.ErrorCode;
import com.ai.bookingbot.exception.NotFoundException;
import com.ai.bookingbot.exception.ValidationException;
import com.ai.bookingbot.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Operator side of appointments. Creation goes through the {@link BookingArbiter} like the bot does.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private static final Set<Appointment.Status> FROM_CONFIRMED = EnumSet.of(
            Appointment.Status.CANCELLED, Appointment.Status.COMPLETED, Appointment.Status.NO_SHOW);

    private final BookingArbiter bookingArbiter;
    private final AppointmentRepository appointmentRepository;
    private final ClientSafetyService clientSafetyService;

    public AppointmentService(BookingArbiter bookingArbiter,
                              AppointmentRepository appointmentRepository,
                              ClientSafetyService clientSafetyService) {
        this.bookingArbiter = bookingArbiter;
        this.appointmentRepository = appointmentRepository;
        this.clientSafetyService = clientSafetyService;
    }

    /**
     * Books on behalf of the operator. Overlap, hours and blocked ranges are enforced; the
     * availability mode is not.
     *
     * @throws AvailabilityException when the arbiter rejects the time
     */
    @Transactional
    public Appointment bookByOperator(Long slotId, Instant start, int durationMinutes, String clientPhone,
                                      String clientName, String serviceRef, PricingCategory category,
                                      Long totalPriceMinor, String notes) {
        BookingResult result = bookingArbiter.commitAppointment(BookingRequest.builder()
                .slotId(slotId)
                .start(start)
                .durationMinutes(durationMinutes)
                .clientPhone(ClientSafetyService.normalizePhone(clientPhone))
                .clientName(clientName)
                .serviceRef(serviceRef)
                .category(category)
                .totalPriceMinor(totalPriceMinor)
                .notes(notes)
                .origin(BookingOrigin.OPERATOR)
                .build());
        if (!result.success()) {
            throw new AvailabilityException(result.reason());
        }
        return result.appointment();
    }

    @Transactional
    public Appointment updateStatus(Long appointmentId, Appointment.Status status) {
        if (status == null) throw new ValidationException("Status is required.");
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.APPOINTMENT_NOT_FOUND, appointmentId));
        Appointment.Status current = appointment.getStatus();
        if (current != Appointment.Status.CONFIRMED || !FROM_CONFIRMED.contains(status)) {
            throw new ValidationException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Cannot move appointment " + appointmentId + " from " + current + " to " + status);
        }
        appointment.setStatus(status);
        appointment = appointmentRepository.save(appointment);
        log.info("Appointment {} status {} -> {}", appointmentId, current, status);

        if (status == Appointment.Status.NO_SHOW) {
            clientSafetyService.report(appointment.getSlot().getProvider().getId(), appointment.getClientPhone(),
                    "No-show on appointment " + appointmentId);
        }
        return appointment;
    }

    @Transactional(readOnly = true)
    public Appointment get(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.APPOINTMENT_NOT_FOUND, appointmentId));
    }
}
