package com.ai.bookingbot.notification;

/**
 * Outbound side of the chat channel.
 */
public interface ChatTransport {

    /**
     * @return true when the message was handed to the channel
     */
    boolean send(String fromNumber, String toPhone, String text);
}
