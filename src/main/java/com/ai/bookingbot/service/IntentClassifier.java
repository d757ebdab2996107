package com.ai.bookingbot.service;

import com.ai.bookingbot.conversation.ConversationIntent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Keyword classifier for the commands available at every step. Cancellation takes
 * precedence over everything else.
 */
@Service
public class IntentClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern CANCEL = Pattern.compile(
            "\\b(annuler|annule|annulation|cancel|stop|arr[eê]te[rz]?)\\b", FLAGS);

    private static final Pattern BACK = Pattern.compile(
            "\\b(retour|revenir|pr[eé]c[eé]dent|back|previous|go back)\\b", FLAGS);

    private static final Pattern PRICE_LIST = Pattern.compile(
            "\\b(prix|tarifs?|price|prices|pricing|rates)\\b", FLAGS);

    private static final Pattern RECAP = Pattern.compile(
            "\\b(total|recap|r[eé]cap|r[eé]capitulatif|summary)\\b", FLAGS);

    private static final Pattern HELP = Pattern.compile(
            "\\b(aide|help|menu)\\b", FLAGS);

    public ConversationIntent classify(String userText) {
        if (StringUtils.isBlank(userText)) return ConversationIntent.NONE;
        String t = userText.trim();
        if (CANCEL.matcher(t).find()) return ConversationIntent.CANCEL;
        if (BACK.matcher(t).find()) return ConversationIntent.BACK;
        if (PRICE_LIST.matcher(t).find()) return ConversationIntent.PRICE_LIST;
        if (RECAP.matcher(t).find()) return ConversationIntent.RECAP;
        if (HELP.matcher(t).find() || "?".equals(t)) return ConversationIntent.HELP;
        return ConversationIntent.NONE;
    }
}
