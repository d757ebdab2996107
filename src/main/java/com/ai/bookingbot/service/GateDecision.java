package com.ai.bookingbot.service;

/**
 * Outcome of the availability mode gate.
 */
public record GateDecision(boolean allowed, Reason reason) {

    public enum Reason {
        ACTIVE,
        MANUAL_OVERRIDE,
        GHOST,
        AWAY,
        CLIENT_FLAGGED
    }

    private static final GateDecision ALLOWED = new GateDecision(true, Reason.ACTIVE);

    public static GateDecision allow() {
        return ALLOWED;
    }

    public static GateDecision deny(Reason reason) {
        return new GateDecision(false, reason);
    }
}
