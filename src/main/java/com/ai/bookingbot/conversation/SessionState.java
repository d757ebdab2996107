package com.ai.bookingbot.conversation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Booking conversation states. The happy path is linear; CANCELLED and EXPIRED are
 * reachable from every non-terminal state.
 */
public enum SessionState {
    AWAITING_CATEGORY,
    AWAITING_DURATION,
    AWAITING_EXTRAS,
    AWAITING_SLOT_CHOICE,
    AWAITING_CONFIRMATION,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    private static final Set<SessionState> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, EXPIRED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Previous step for back-navigation; the first step and terminal states return themselves.
     */
    public SessionState previous() {
        switch (this) {
            case AWAITING_DURATION:
                return AWAITING_CATEGORY;
            case AWAITING_EXTRAS:
                return AWAITING_DURATION;
            case AWAITING_SLOT_CHOICE:
                return AWAITING_EXTRAS;
            case AWAITING_CONFIRMATION:
                return AWAITING_SLOT_CHOICE;
            default:
                return this;
        }
    }
}
