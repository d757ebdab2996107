package com.ai.bookingbot.conversation;

public record ChatMessage(String role, String content) {
}
