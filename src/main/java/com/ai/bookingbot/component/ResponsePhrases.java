package com.ai.bookingbot.component;

import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.exception.PricingError;
import com.ai.bookingbot.service.LanguageDetector;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reply texts of the booking assistant, in French (default) or English.
 */
@Component
public class ResponsePhrases {

    private static final DateTimeFormatter START_FR = DateTimeFormatter.ofPattern("EEEE d MMMM 'à' HH:mm", Locale.FRENCH);
    private static final DateTimeFormatter START_EN = DateTimeFormatter.ofPattern("EEEE d MMMM 'at' HH:mm", Locale.ENGLISH);

    public String greeting(String lang, String businessName) {
        return en(lang)
                ? "Hello and welcome to " + businessName + "! I can book your appointment. Type \"cancel\" at any time to stop."
                : "Bonjour et bienvenue chez " + businessName + " ! Je peux réserver votre rendez-vous. Tapez \"annuler\" à tout moment pour arrêter.";
    }

    public String previousSessionExpired(String lang) {
        return en(lang)
                ? "Your previous request timed out, let's start again."
                : "Votre demande précédente a expiré, reprenons depuis le début.";
    }

    public String categoryPrompt(String lang, Map<Integer, String> options) {
        return (en(lang) ? "What kind of appointment would you like?" : "Quel type de rendez-vous souhaitez-vous ?")
                + "\n" + numbered(options)
                + "\n" + (en(lang) ? "Reply with the number." : "Répondez avec le numéro.");
    }

    public String categoryLabel(String lang, PricingCategory category) {
        if (category == PricingCategory.OUTCALL) {
            return en(lang) ? "Outcall (I come to you)" : "Déplacement (je me déplace)";
        }
        return en(lang) ? "Private (at my place)" : "Privé (chez moi)";
    }

    public String noServiceAvailable(String lang) {
        return en(lang)
                ? "Sorry, no service can be booked at the moment."
                : "Désolé, aucune prestation n'est réservable pour le moment.";
    }

    public String durationPrompt(String lang, Map<Integer, String> options) {
        return (en(lang) ? "Which duration?" : "Quelle durée ?")
                + "\n" + numbered(options)
                + "\n" + (en(lang) ? "Reply with the number." : "Répondez avec le numéro.");
    }

    public String durationOption(int minutes, long priceMinor) {
        return durationLabel(minutes) + " - " + formatPrice(priceMinor);
    }

    public String extrasPrompt(String lang, Map<Integer, String> options, List<String> selected, long totalMinor) {
        StringBuilder sb = new StringBuilder();
        sb.append(en(lang) ? "Any extras? Send +N to add or remove one:" : "Des suppléments ? Envoyez +N pour en ajouter ou retirer un :");
        sb.append("\n").append(numbered(options));
        if (!selected.isEmpty()) {
            sb.append("\n").append(en(lang) ? "Selected: " : "Choisis : ").append(String.join(", ", selected));
        }
        sb.append("\n").append(en(lang) ? "Current total: " : "Total actuel : ").append(formatPrice(totalMinor));
        sb.append("\n").append(en(lang) ? "Send 0 to continue." : "Envoyez 0 pour continuer.");
        return sb.toString();
    }

    public String extraOption(String name, long priceMinor) {
        return name + " (+" + formatPrice(priceMinor) + ")";
    }

    public String extrasUpdated(String lang, List<String> added, List<String> removed, long totalMinor) {
        StringBuilder sb = new StringBuilder();
        if (!added.isEmpty()) {
            sb.append(en(lang) ? "Added: " : "Ajouté : ").append(String.join(", ", added));
        }
        if (!removed.isEmpty()) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(en(lang) ? "Removed: " : "Retiré : ").append(String.join(", ", removed));
        }
        sb.append("\n").append(en(lang) ? "Current total: " : "Total actuel : ").append(formatPrice(totalMinor));
        sb.append("\n").append(en(lang) ? "Another extra (+N) or 0 to continue." : "Un autre supplément (+N) ou 0 pour continuer.");
        return sb.toString();
    }

    public String slotChoicePrompt(String lang, Map<Integer, String> options) {
        return (en(lang) ? "Here are the next available times:" : "Voici les prochaines disponibilités :")
                + "\n" + numbered(options)
                + "\n" + (en(lang) ? "Reply with the number of your choice." : "Répondez avec le numéro de votre choix.");
    }

    public String noAvailability(String lang) {
        return en(lang)
                ? "Sorry, there is no availability in the coming days. Type \"back\" to change your request or try again later."
                : "Désolé, aucune disponibilité dans les prochains jours. Tapez \"retour\" pour modifier votre demande ou réessayez plus tard.";
    }

    public String awayNextAvailable(String lang, List<String> starts) {
        String head = en(lang)
                ? "I can't book automatically right now, you will be contacted to confirm. Next free times:"
                : "Je ne peux pas réserver automatiquement pour le moment, on vous recontactera pour confirmer. Prochaines disponibilités :";
        return head + "\n" + starts.stream().map(s -> "- " + s).collect(Collectors.joining("\n"));
    }

    public String autoBookingSuspended(String lang) {
        return en(lang)
                ? "Online booking is temporarily unavailable. Please try again later."
                : "La réservation en ligne est momentanément indisponible. Merci de réessayer plus tard.";
    }

    public String manualFollowUp(String lang) {
        return en(lang)
                ? "Your request has been noted, you will be contacted directly."
                : "Votre demande est notée, vous serez contacté directement.";
    }

    public String slotTaken(String lang) {
        return en(lang)
                ? "Sorry, this time has just been booked by someone else."
                : "Désolé, ce créneau vient d'être réservé par quelqu'un d'autre.";
    }

    public String slotNoLongerAvailable(String lang) {
        return en(lang)
                ? "Sorry, this time is no longer available."
                : "Désolé, ce créneau n'est plus disponible.";
    }

    public String listOutdated(String lang) {
        return en(lang)
                ? "That list is no longer valid."
                : "Cette liste n'est plus valable.";
    }

    public String invalidChoice(String lang, int max) {
        return en(lang)
                ? "Please reply with a number between 1 and " + max + "."
                : "Merci de répondre avec un numéro entre 1 et " + max + ".";
    }

    public String confirmationPrompt(String lang, String categoryLabel, int durationMinutes, List<String> extras,
                                     long totalMinor, Instant start, ZoneId zone, String approximateAddress) {
        StringBuilder sb = new StringBuilder();
        sb.append(en(lang) ? "Please confirm your appointment:" : "Merci de confirmer votre rendez-vous :");
        sb.append("\n- ").append(categoryLabel).append(", ").append(durationLabel(durationMinutes));
        if (!extras.isEmpty()) {
            sb.append("\n- ").append(en(lang) ? "Extras: " : "Suppléments : ").append(String.join(", ", extras));
        }
        sb.append("\n- ").append(formatStart(lang, start, zone));
        if (approximateAddress != null) {
            sb.append("\n- ").append(en(lang) ? "Area: " : "Secteur : ").append(approximateAddress);
        }
        sb.append("\n- Total : ").append(formatPrice(totalMinor));
        sb.append("\n").append(en(lang) ? "Reply yes to confirm or no to pick another time." : "Répondez oui pour confirmer ou non pour choisir un autre créneau.");
        return sb.toString();
    }

    public String confirmationReminder(String lang) {
        return en(lang) ? "Reply yes to confirm or no to pick another time." : "Répondez oui pour confirmer ou non pour choisir un autre créneau.";
    }

    public String booked(String lang, Instant start, ZoneId zone, long totalMinor) {
        return en(lang)
                ? "Your appointment is confirmed for " + formatStart(lang, start, zone) + " (" + formatPrice(totalMinor) + "). The exact address will be sent shortly before. See you soon!"
                : "Votre rendez-vous est confirmé pour " + formatStart(lang, start, zone) + " (" + formatPrice(totalMinor) + "). L'adresse exacte vous sera envoyée peu avant. À bientôt !";
    }

    public String cancelled(String lang) {
        return en(lang)
                ? "Your request has been cancelled. Write again whenever you like."
                : "Votre demande est annulée. Écrivez-nous quand vous voulez.";
    }

    public String help(String lang) {
        return en(lang)
                ? "Commands: \"price\" for the price list, \"total\" for your summary, \"back\" for the previous step, \"cancel\" to stop."
                : "Commandes : \"prix\" pour les tarifs, \"total\" pour le récapitulatif, \"retour\" pour l'étape précédente, \"annuler\" pour arrêter.";
    }

    public String priceList(String lang, List<String> tierLines, List<String> extraLines) {
        StringBuilder sb = new StringBuilder(en(lang) ? "Prices:" : "Tarifs :");
        if (tierLines.isEmpty()) {
            sb.append("\n").append(en(lang) ? "(none)" : "(aucun)");
        }
        tierLines.forEach(line -> sb.append("\n- ").append(line));
        if (!extraLines.isEmpty()) {
            sb.append("\n").append(en(lang) ? "Extras:" : "Suppléments :");
            extraLines.forEach(line -> sb.append("\n- ").append(line));
        }
        return sb.toString();
    }

    public String recap(String lang, String categoryLabel, Integer durationMinutes, List<String> extras,
                        long totalMinor, String start) {
        StringBuilder sb = new StringBuilder(en(lang) ? "Your request so far:" : "Votre demande en cours :");
        sb.append("\n- ").append(en(lang) ? "Type: " : "Type : ").append(categoryLabel != null ? categoryLabel : "-");
        sb.append("\n- ").append(en(lang) ? "Duration: " : "Durée : ").append(durationMinutes != null ? durationLabel(durationMinutes) : "-");
        sb.append("\n- ").append(en(lang) ? "Extras: " : "Suppléments : ").append(extras.isEmpty() ? "-" : String.join(", ", extras));
        sb.append("\n- ").append(en(lang) ? "Time: " : "Créneau : ").append(start != null ? start : "-");
        sb.append("\n- Total : ").append(formatPrice(totalMinor));
        return sb.toString();
    }

    public String pricingError(String lang, PricingError error) {
        switch (error) {
            case CATEGORY_UNAVAILABLE_FOR_DURATION:
                return en(lang) ? "Outcall is only available from one hour." : "Le déplacement n'est possible qu'à partir d'une heure.";
            case TIER_INACTIVE:
                return en(lang) ? "This duration is not offered at the moment." : "Cette durée n'est pas proposée pour le moment.";
            case TIER_UNDEFINED:
                return en(lang) ? "This duration is not offered." : "Cette durée n'est pas proposée.";
            case EXTRA_UNAVAILABLE:
            default:
                return en(lang) ? "This extra is not available." : "Ce supplément n'est pas disponible.";
        }
    }

    public String reminder(String lang, Instant start, ZoneId zone, String exactAddress) {
        String when = formatStart(lang, start, zone);
        if (en(lang)) {
            return "Reminder: your appointment is " + when + "." + (exactAddress != null ? " Address: " + exactAddress : "");
        }
        return "Rappel : votre rendez-vous est " + when + "." + (exactAddress != null ? " Adresse : " + exactAddress : "");
    }

    public String formatStart(String lang, Instant start, ZoneId zone) {
        return (en(lang) ? START_EN : START_FR).format(start.atZone(zone));
    }

    public static String durationLabel(int minutes) {
        if (minutes < 60) return minutes + " min";
        int h = minutes / 60;
        int m = minutes % 60;
        return m == 0 ? h + "h" : h + "h" + String.format("%02d", m);
    }

    public static String formatPrice(long minor) {
        long units = minor / 100;
        long cents = Math.abs(minor % 100);
        return cents == 0 ? units + " €" : units + "," + String.format("%02d", cents) + " €";
    }

    private static String numbered(Map<Integer, String> options) {
        return options.entrySet().stream()
                .map(e -> e.getKey() + ". " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    private static boolean en(String lang) {
        return LanguageDetector.ENGLISH.equals(lang);
    }
}
