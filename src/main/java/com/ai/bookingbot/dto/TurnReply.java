package com.ai.bookingbot.dto;

import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.entity.ConversationSession;

/**
 * Outcome of one chat turn. A silent reply sends nothing back to the client.
 */
public record TurnReply(String text, boolean silent, Long sessionId, SessionState state, Long appointmentId) {

    public static TurnReply ignored() {
        return new TurnReply(null, true, null, null, null);
    }

    public static TurnReply of(String text, ConversationSession session) {
        return new TurnReply(text, false, session.getId(), session.getState(), session.getAppointmentId());
    }
}
