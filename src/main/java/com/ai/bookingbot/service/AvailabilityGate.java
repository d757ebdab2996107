package com.ai.bookingbot.service;

import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.entity.AvailabilityMode;
import com.ai.bookingbot.entity.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Decides whether the bot may book a slot on its own right now. Evaluated when times are
 * offered and again inside the commit.
 */
@Service
public class AvailabilityGate {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityGate.class);

    private final ClientSafetyService clientSafetyService;
    private final BookingProperties properties;

    public AvailabilityGate(ClientSafetyService clientSafetyService, BookingProperties properties) {
        this.clientSafetyService = clientSafetyService;
        this.properties = properties;
    }

    public GateDecision canAutoBook(Slot slot, Instant now) {
        // manual override wins over every mode
        if (slot.getManualOverrideUntil() != null && now.isBefore(slot.getManualOverrideUntil())) {
            return GateDecision.deny(GateDecision.Reason.MANUAL_OVERRIDE);
        }
        AvailabilityMode mode = slot.getAvailabilityMode() != null ? slot.getAvailabilityMode() : AvailabilityMode.ACTIVE;
        switch (mode) {
            case GHOST:
                return GateDecision.deny(GateDecision.Reason.GHOST);
            case AWAY:
                return GateDecision.deny(GateDecision.Reason.AWAY);
            default:
                return GateDecision.allow();
        }
    }

    /**
     * Same as {@link #canAutoBook(Slot, Instant)}, additionally refusing clients on the shared blacklist.
     */
    public GateDecision canAutoBook(Slot slot, String clientPhone, Instant now) {
        GateDecision decision = canAutoBook(slot, now);
        if (!decision.allowed()) return decision;
        if (clientSafetyService.isBlacklisted(clientPhone)) {
            log.warn("Auto booking refused for flagged client {} on slot {}", clientPhone, slot.getId());
            return GateDecision.deny(GateDecision.Reason.CLIENT_FLAGGED);
        }
        return decision;
    }

    /**
     * Whether a refused client may still be told the next free times for a manual follow-up.
     */
    public boolean mayShowNextAvailable(GateDecision decision) {
        return decision.reason() == GateDecision.Reason.AWAY && properties.isAwayShowsNextAvailable();
    }
}
