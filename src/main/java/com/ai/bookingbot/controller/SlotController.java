package com.ai.bookingbot.controller;

import com.ai.bookingbot.dto.AvailabilityModeRequest;
import com.ai.bookingbot.dto.ManualOverrideRequest;
import com.ai.bookingbot.dto.SlotDto;
import com.ai.bookingbot.service.SlotConfigurationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/slots")
public class SlotController {

    private final SlotConfigurationService configuration;

    public SlotController(SlotConfigurationService configuration) {
        this.configuration = configuration;
    }

    @PatchMapping("/{slotId}/availability-mode")
    public SlotDto updateMode(@PathVariable Long slotId, @Valid @RequestBody AvailabilityModeRequest request) {
        return SlotDto.from(configuration.updateAvailabilityMode(slotId, request.mode()));
    }

    @PatchMapping("/{slotId}/manual-override")
    public SlotDto manualOverride(@PathVariable Long slotId, @RequestBody ManualOverrideRequest request) {
        return SlotDto.from(configuration.setManualOverride(slotId, request.until()));
    }
}
