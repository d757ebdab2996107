package com.ai.bookingbot.service;

import com.ai.bookingbot.conversation.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a confirmation answer (French or English) into YES, NO or UNKNOWN.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "oui", "ouais", "ouep", "ok", "okay", "d'accord", "dac", "parfait", "c'est bon", "vas-y",
            "je confirme", "confirme", "yes", "yeah", "yep", "yup", "sure", "confirm", "correct", "go"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "non", "nan", "no", "nope", "nah", "pas maintenant", "plus tard", "later", "not now"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(oui|ouais|ok|okay|d'accord|parfait|confirme|confirmer|c'est bon|yes|yeah|yep|sure|confirm|correct)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(non|nan|no|nope|nah|pas|autre|another|different|later|plus tard)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS
    );

    /**
     * Mixed answers ("oui mais non") are UNKNOWN so nothing gets committed by accident.
     */
    public YesNoResult classify(String userInput) {
        if (StringUtils.isBlank(userInput)) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = StringUtils.normalizeSpace(userInput).toLowerCase()
                .replace('’', '\'')
                .replaceAll("[!.?]+$", "");

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }

        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return YesNoResult.UNKNOWN;
        }
        if (affirmative) {
            return YesNoResult.YES;
        }
        if (negative) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }

    public boolean isAffirmative(String userInput) {
        return classify(userInput) == YesNoResult.YES;
    }

    public boolean isNegative(String userInput) {
        return classify(userInput) == YesNoResult.NO;
    }
}
