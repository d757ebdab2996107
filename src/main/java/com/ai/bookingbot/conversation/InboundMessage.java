package com.ai.bookingbot.conversation;

/**
 * One inbound chat turn. {@code slotId} may be null when the channel does not identify a slot.
 */
public record InboundMessage(Long providerId, Long slotId, String clientPhone, String body) {
}
