package com.ai.bookingbot.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Keyword vote between French and English. Returns empty when the message says nothing
 * about its language (numbers, "ok", ties).
 */
@Service
public class LanguageDetector {

    public static final String FRENCH = "fr";
    public static final String ENGLISH = "en";

    private static final Set<String> FRENCH_WORDS = Set.of(
            "bonjour", "bonsoir", "salut", "oui", "non", "merci", "prix", "tarif", "tarifs", "annuler", "retour",
            "suivant", "je", "veux", "voudrais", "rendez-vous", "rdv", "prive", "privé", "déplacement", "deplacement",
            "quand", "demain", "aujourd'hui", "svp", "s'il", "plait", "plaît", "est", "c'est", "pour", "une", "heure"
    );

    private static final Set<String> ENGLISH_WORDS = Set.of(
            "hello", "hi", "hey", "yes", "no", "thanks", "thank", "price", "prices", "cancel", "back", "next", "done",
            "i", "want", "would", "like", "book", "appointment", "private", "outcall", "when", "tomorrow", "today",
            "please", "is", "for", "an", "hour", "the"
    );

    public Optional<String> detect(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        int fr = 0;
        int en = 0;
        for (String token : text.toLowerCase().replace('’', '\'').split("[^\\p{L}'-]+")) {
            if (token.isEmpty()) continue;
            if (FRENCH_WORDS.contains(token)) fr++;
            if (ENGLISH_WORDS.contains(token)) en++;
        }
        if (fr > en) return Optional.of(FRENCH);
        if (en > fr) return Optional.of(ENGLISH);
        return Optional.empty();
    }
}
