package com.ai.bookingbot.controller;

import com.ai.bookingbot.dto.AppointmentDto;
import com.ai.bookingbot.dto.OperatorBookingRequest;
import com.ai.bookingbot.dto.StatusUpdateRequest;
import com.ai.bookingbot.entity.Appointment;
import com.ai.bookingbot.service.AppointmentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AppointmentController {

    private final AppointmentService appointmentService;

    public AppointmentController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @PostMapping("/slots/{slotId}/appointments")
    public ResponseEntity<AppointmentDto> book(@PathVariable Long slotId, @Valid @RequestBody OperatorBookingRequest request) {
        Appointment appointment = appointmentService.bookByOperator(slotId, request.start(), request.durationMinutes(),
                request.clientPhone(), request.clientName(), request.serviceRef(), request.category(),
                request.totalPriceMinor(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentDto.from(appointment));
    }

    @GetMapping("/appointments/{id}")
    public AppointmentDto get(@PathVariable Long id) {
        return AppointmentDto.from(appointmentService.get(id));
    }

    @PatchMapping("/appointments/{id}/status")
    public AppointmentDto updateStatus(@PathVariable Long id, @Valid @RequestBody StatusUpdateRequest request) {
        return AppointmentDto.from(appointmentService.updateStatus(id, request.status()));
    }
}
