package com.ai.bookingbot.conversation;

/**
 * Commands recognised in any non-terminal state, before the state's own input handling.
 */
public enum ConversationIntent {
    CANCEL,
    BACK,
    PRICE_LIST,
    RECAP,
    HELP,
    NONE
}
