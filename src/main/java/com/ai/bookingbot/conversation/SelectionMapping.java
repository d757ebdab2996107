package com.ai.bookingbot.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numbered options shown to the client in one prompt. Valid only for the state and the
 * session generation it was issued for, so a number typed against an older list is
 * detected structurally.
 */
public record SelectionMapping(SessionState state, int generation, Instant issuedAt, Map<Integer, String> options) {

    public SelectionMapping {
        options = options == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public boolean isValidFor(SessionState currentState, int currentGeneration) {
        return state == currentState && generation == currentGeneration;
    }

    public boolean isOlderThan(Duration ttl, Instant now) {
        return issuedAt == null || issuedAt.plus(ttl).isBefore(now);
    }

    public String resolve(int ordinal) {
        return options.get(ordinal);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return options.isEmpty();
    }
}
