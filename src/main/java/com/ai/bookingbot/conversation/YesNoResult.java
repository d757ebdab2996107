package com.ai.bookingbot.conversation;

public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
