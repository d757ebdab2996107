package com.ai.bookingbot.service;

import com.ai.bookingbot.calendar.TimeWindow;
import com.ai.bookingbot.component.ConversationStore;
import com.ai.bookingbot.component.ResponsePhrases;
import com.ai.bookingbot.config.BookingProperties;
import com.ai.bookingbot.conversation.InboundMessage;
import com.ai.bookingbot.conversation.SelectionMapping;
import com.ai.bookingbot.conversation.SessionLockRegistry;
import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.dto.TurnReply;
import com.ai.bookingbot.entity.ConversationSession;
import com.ai.bookingbot.entity.Extra;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.entity.PricingTier;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.exception.PricingError;
import com.ai.bookingbot.exception.PricingException;
import com.ai.bookingbot.exception.SessionError;
import com.ai.bookingbot.exception.SessionException;
import com.ai.bookingbot.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Drives the booking conversation: category, duration, extras, time, confirmation.
 * Turns of one (provider, phone) pair run one at a time; every numbered answer is checked
 * against the list shown for the current step.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    /** Numbers up to this value are list ordinals when picking a duration, larger ones are minutes. */
    private static final int MAX_DURATION_ORDINAL = 12;

    private static final Pattern NUMBER = Pattern.compile("^\\+?\\s*(\\d{1,4})$");
    private static final Pattern EXTRA_SELECTION = Pattern.compile("^(\\+?\\s*\\d{1,2}[\\s,;]*)+$");
    private static final Pattern EXTRA_NUMBER = Pattern.compile("\\d{1,2}");
    private static final Pattern HOURS = Pattern.compile("^(\\d{1,2})\\s*h(?:eures?|ours?|rs?)?\\s*(\\d{1,2})?\\s*(?:min)?$");
    private static final Pattern MINUTES = Pattern.compile("^(\\d{1,4})\\s*(?:min|mn|mins|minutes?)$");
    private static final Pattern PRIVATE = Pattern.compile("\\b(priv[eé]e?|private|incall)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern OUTCALL = Pattern.compile("\\b(outcall|escort|d[eé]placement|d[eé]placer)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Set<String> DONE_WORDS = Set.of(
            "0", "done", "ok", "okay", "next", "suivant", "fini", "termine", "terminé", "continuer", "continue", "non", "no");

    private final SessionLockRegistry lockRegistry;
    private final SessionStore sessionStore;
    private final ConversationStore conversationStore;
    private final SlotConfigurationService configuration;
    private final CalendarService calendarService;
    private final AvailabilityGate availabilityGate;
    private final BookingArbiter bookingArbiter;
    private final PricingService pricingService;
    private final ClientSafetyService clientSafetyService;
    private final IntentClassifier intentClassifier;
    private final YesNoClassifier yesNoClassifier;
    private final LanguageDetector languageDetector;
    private final ResponsePhrases phrases;
    private final BookingProperties properties;
    private final Clock clock;

    public ConversationService(SessionLockRegistry lockRegistry,
                               SessionStore sessionStore,
                               ConversationStore conversationStore,
                               SlotConfigurationService configuration,
                               CalendarService calendarService,
                               AvailabilityGate availabilityGate,
                               BookingArbiter bookingArbiter,
                               PricingService pricingService,
                               ClientSafetyService clientSafetyService,
                               IntentClassifier intentClassifier,
                               YesNoClassifier yesNoClassifier,
                               LanguageDetector languageDetector,
                               ResponsePhrases phrases,
                               BookingProperties properties,
                               Clock clock) {
        this.lockRegistry = lockRegistry;
        this.sessionStore = sessionStore;
        this.conversationStore = conversationStore;
        this.configuration = configuration;
        this.calendarService = calendarService;
        this.availabilityGate = availabilityGate;
        this.bookingArbiter = bookingArbiter;
        this.pricingService = pricingService;
        this.clientSafetyService = clientSafetyService;
        this.intentClassifier = intentClassifier;
        this.yesNoClassifier = yesNoClassifier;
        this.languageDetector = languageDetector;
        this.phrases = phrases;
        this.properties = properties;
        this.clock = clock;
    }

    public TurnReply handleTurn(InboundMessage message) {
        if (message.providerId() == null) {
            throw new ValidationException("Provider is required.");
        }
        String phone = ClientSafetyService.normalizePhone(message.clientPhone());
        if (phone.isEmpty()) {
            throw new ValidationException("Client phone is required.");
        }
        if (clientSafetyService.isBlockedByProvider(message.providerId(), phone)) {
            log.warn("Ignoring message from blocked client {} (provider={})", phone, message.providerId());
            return TurnReply.ignored();
        }
        return lockRegistry.withLock(message.providerId(), phone, () -> processTurn(message, phone));
    }

    private TurnReply processTurn(InboundMessage message, String phone) {
        Instant now = clock.instant();
        Slot slot = configuration.resolveConversationSlot(message.providerId(), message.slotId());
        SessionStore.SessionLookup lookup = sessionStore.open(message.providerId(), phone, slot.getId(), now);
        ConversationSession session = lookup.session();
        if (!Objects.equals(session.getSlotId(), slot.getId())) {
            slot = configuration.requireSlot(session.getSlotId());
        }

        String body = StringUtils.trimToEmpty(message.body());
        languageDetector.detect(body).ifPresent(session::setLanguage);
        log.debug("Turn provider={} client={} session={} state={}", message.providerId(), phone, session.getId(), session.getState());

        Turn turn = new Turn(session, slot, configuration.zoneOf(slot), now);
        if (lookup.created()) {
            if (lookup.previousExpired()) {
                turn.say(phrases.previousSessionExpired(turn.lang()));
            }
            turn.say(phrases.greeting(turn.lang(), slot.getProvider().getBusinessName()));
        }
        dispatch(turn, body, lookup.created());

        session = sessionStore.save(session, now);
        conversationStore.appendUser(session.getId(), body);
        conversationStore.appendAssistant(session.getId(), turn.text());
        return TurnReply.of(turn.text(), session);
    }

    private void dispatch(Turn turn, String body, boolean fresh) {
        switch (intentClassifier.classify(body)) {
            case CANCEL:
                cancel(turn);
                return;
            case BACK:
                if (!fresh) {
                    back(turn);
                    return;
                }
                break;
            case PRICE_LIST:
                turn.say(priceList(turn));
                if (fresh) promptCategory(turn);
                return;
            case RECAP:
                turn.say(recap(turn));
                if (fresh) promptCategory(turn);
                return;
            case HELP:
                turn.say(phrases.help(turn.lang()));
                if (fresh) {
                    promptCategory(turn);
                } else {
                    reprompt(turn);
                }
                return;
            default:
                break;
        }
        if (fresh) {
            // a new session only understands a category keyword, anything else gets the menu
            Optional<PricingCategory> category = categoryKeyword(body);
            if (category.isPresent()) {
                chooseCategory(turn, category.get());
            } else {
                promptCategory(turn);
            }
            return;
        }

        try {
            switch (turn.session.getState()) {
                case AWAITING_CATEGORY:
                    onCategory(turn, body);
                    break;
                case AWAITING_DURATION:
                    onDuration(turn, body);
                    break;
                case AWAITING_EXTRAS:
                    onExtras(turn, body);
                    break;
                case AWAITING_SLOT_CHOICE:
                    onSlotChoice(turn, body);
                    break;
                case AWAITING_CONFIRMATION:
                    onConfirmation(turn, body);
                    break;
                default:
                    throw new SessionException(SessionError.SESSION_EXPIRED);
            }
        } catch (SessionException e) {
            log.debug("Session {} {} in state {}", turn.session.getId(), e.getError(), turn.session.getState());
            turn.say(phrases.listOutdated(turn.lang()));
            reprompt(turn);
        } catch (PricingException e) {
            log.warn("Pricing refused for session {}: {}", turn.session.getId(), e.getMessage());
            turn.say(phrases.pricingError(turn.lang(), e.getError()));
            reprompt(turn);
        }
    }

    // =========================================================
    // CATEGORY
    // =========================================================
    private void promptCategory(Turn turn) {
        Map<Integer, String> options = new LinkedHashMap<>();
        Map<Integer, String> labels = new LinkedHashMap<>();
        int i = 1;
        for (PricingCategory category : PricingCategory.values()) {
            if (!pricingService.sellableTiers(turn.slot, category).isEmpty()) {
                options.put(i, category.name());
                labels.put(i, phrases.categoryLabel(turn.lang(), category));
                i++;
            }
        }
        issue(turn, SessionState.AWAITING_CATEGORY, options);
        if (options.isEmpty()) {
            turn.say(phrases.noServiceAvailable(turn.lang()));
            return;
        }
        turn.say(phrases.categoryPrompt(turn.lang(), labels));
    }

    private void onCategory(Turn turn, String body) {
        Optional<PricingCategory> category = categoryKeyword(body);
        if (category.isEmpty()) {
            OptionalInt n = parseNumber(body);
            if (n.isEmpty()) {
                promptCategory(turn);
                return;
            }
            String value = resolve(turn, n.getAsInt());
            if (value == null) {
                turn.say(phrases.invalidChoice(turn.lang(), turn.session.getSelectionMapping().options().size()));
                return;
            }
            category = Optional.of(PricingCategory.valueOf(value));
        }
        chooseCategory(turn, category.get());
    }

    private void chooseCategory(Turn turn, PricingCategory category) {
        if (pricingService.sellableTiers(turn.slot, category).isEmpty()) {
            turn.say(phrases.pricingError(turn.lang(), PricingError.TIER_UNDEFINED));
            promptCategory(turn);
            return;
        }
        ConversationSession session = turn.session;
        session.setCategory(category);
        session.setDurationMinutes(null);
        session.setBasePriceMinor(0);
        session.setExtras(new ArrayList<>());
        session.setExtrasTotalMinor(0);
        session.setSelectedStart(null);
        promptDuration(turn);
    }

    // =========================================================
    // DURATION
    // =========================================================
    private void promptDuration(Turn turn) {
        List<PricingTier> tiers = pricingService.sellableTiers(turn.slot, turn.session.getCategory());
        if (tiers.isEmpty()) {
            promptCategory(turn);
            return;
        }
        Map<Integer, String> options = new LinkedHashMap<>();
        Map<Integer, String> labels = new LinkedHashMap<>();
        int i = 1;
        for (PricingTier tier : tiers) {
            options.put(i, String.valueOf(tier.getDurationMinutes()));
            labels.put(i, phrases.durationOption(tier.getDurationMinutes(), tier.getPriceMinor()));
            i++;
        }
        issue(turn, SessionState.AWAITING_DURATION, options);
        turn.say(phrases.durationPrompt(turn.lang(), labels));
    }

    private void onDuration(Turn turn, String body) {
        OptionalInt n = parseNumber(body);
        Integer minutes;
        if (n.isPresent() && n.getAsInt() <= MAX_DURATION_ORDINAL) {
            String value = resolve(turn, n.getAsInt());
            if (value == null) {
                turn.say(phrases.invalidChoice(turn.lang(), turn.session.getSelectionMapping().options().size()));
                return;
            }
            minutes = Integer.valueOf(value);
        } else if (n.isPresent()) {
            minutes = n.getAsInt();
        } else {
            minutes = parseDurationLiteral(body);
        }
        if (minutes == null) {
            promptDuration(turn);
            return;
        }
        chooseDuration(turn, minutes);
    }

    private void chooseDuration(Turn turn, int minutes) {
        ConversationSession session = turn.session;
        PriceQuote quote;
        try {
            quote = pricingService.quote(turn.slot, minutes, session.getCategory(), session.getExtras());
        } catch (PricingException e) {
            if (e.getError() != PricingError.EXTRA_UNAVAILABLE) {
                throw e;
            }
            quote = pricingService.quote(turn.slot, minutes, session.getCategory(), List.of());
        }
        session.setDurationMinutes(minutes);
        applyQuote(session, quote);
        session.setSelectedStart(null);
        promptExtras(turn);
    }

    // =========================================================
    // EXTRAS
    // =========================================================
    private void promptExtras(Turn turn) {
        List<Extra> extras = pricingService.activeExtras(turn.slot);
        if (extras.isEmpty()) {
            offerSlots(turn);
            return;
        }
        Map<Integer, String> options = new LinkedHashMap<>();
        Map<Integer, String> labels = new LinkedHashMap<>();
        int i = 1;
        for (Extra extra : extras) {
            options.put(i, extra.getName());
            labels.put(i, phrases.extraOption(extra.getName(), extra.getPriceMinor()));
            i++;
        }
        issue(turn, SessionState.AWAITING_EXTRAS, options);
        turn.say(phrases.extrasPrompt(turn.lang(), labels, turn.session.getExtras(), turn.session.getTotalPriceMinor()));
    }

    private void onExtras(Turn turn, String body) {
        String t = body.toLowerCase();
        if (DONE_WORDS.contains(t)) {
            offerSlots(turn);
            return;
        }
        if (!EXTRA_SELECTION.matcher(t).matches()) {
            promptExtras(turn);
            return;
        }
        ConversationSession session = turn.session;
        List<String> selected = new ArrayList<>(session.getExtras());
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        Matcher m = EXTRA_NUMBER.matcher(t);
        while (m.find()) {
            String name = resolve(turn, Integer.parseInt(m.group()));
            if (name == null) {
                turn.say(phrases.invalidChoice(turn.lang(), session.getSelectionMapping().options().size()));
                return;
            }
            if (selected.removeIf(s -> s.equalsIgnoreCase(name))) {
                removed.add(name);
            } else {
                selected.add(name);
                added.add(name);
            }
        }
        PriceQuote quote = pricingService.quote(turn.slot, session.getDurationMinutes(), session.getCategory(), selected);
        applyQuote(session, quote);
        turn.say(phrases.extrasUpdated(turn.lang(), added, removed, session.getTotalPriceMinor()));
    }

    // =========================================================
    // TIME CHOICE
    // =========================================================
    private void offerSlots(Turn turn) {
        ConversationSession session = turn.session;
        session.setSelectedStart(null);
        int duration = session.getDurationMinutes();
        GateDecision decision = availabilityGate.canAutoBook(turn.slot, session.getClientPhone(), turn.now);
        if (!decision.allowed()) {
            issue(turn, SessionState.AWAITING_SLOT_CHOICE, Map.of());
            log.info("Slot {} not auto-bookable for client {}: {}", turn.slot.getId(), session.getClientPhone(), decision.reason());
            explainRefusal(turn, decision, duration);
            return;
        }
        List<TimeWindow> openings = calendarService.nextOpenings(turn.slot, duration, properties.getWindowBatchSize(), turn.now);
        Map<Integer, String> options = new LinkedHashMap<>();
        Map<Integer, String> labels = new LinkedHashMap<>();
        int i = 1;
        for (TimeWindow opening : openings) {
            options.put(i, opening.start().toString());
            labels.put(i, phrases.formatStart(turn.lang(), opening.start(), turn.zone));
            i++;
        }
        issue(turn, SessionState.AWAITING_SLOT_CHOICE, options);
        if (options.isEmpty()) {
            turn.say(phrases.noAvailability(turn.lang()));
            return;
        }
        turn.say(phrases.slotChoicePrompt(turn.lang(), labels));
    }

    private void explainRefusal(Turn turn, GateDecision decision, int duration) {
        switch (decision.reason()) {
            case GHOST:
                turn.say(phrases.noAvailability(turn.lang()));
                break;
            case AWAY:
                if (availabilityGate.mayShowNextAvailable(decision)) {
                    List<String> next = calendarService.nextOpenings(turn.slot, duration, 3, turn.now).stream()
                            .map(w -> phrases.formatStart(turn.lang(), w.start(), turn.zone))
                            .collect(Collectors.toList());
                    turn.say(next.isEmpty() ? phrases.noAvailability(turn.lang()) : phrases.awayNextAvailable(turn.lang(), next));
                } else {
                    turn.say(phrases.autoBookingSuspended(turn.lang()));
                }
                break;
            case CLIENT_FLAGGED:
                turn.say(phrases.manualFollowUp(turn.lang()));
                break;
            case MANUAL_OVERRIDE:
            default:
                turn.say(phrases.autoBookingSuspended(turn.lang()));
                break;
        }
    }

    private void onSlotChoice(Turn turn, String body) {
        SelectionMapping mapping = turn.session.getSelectionMapping();
        OptionalInt n = parseNumber(body);
        if (n.isEmpty() || mapping == null || mapping.isEmpty()) {
            offerSlots(turn);
            return;
        }
        String value = resolve(turn, n.getAsInt());
        if (value == null) {
            turn.say(phrases.invalidChoice(turn.lang(), mapping.options().size()));
            return;
        }
        TimeWindow proposal = TimeWindow.ofMinutes(Instant.parse(value), turn.session.getDurationMinutes());
        // the list may be minutes old; check the calendar again before asking for confirmation
        if (calendarService.overlapsAppointment(turn.slot, proposal)) {
            turn.say(phrases.slotTaken(turn.lang()));
            offerSlots(turn);
            return;
        }
        if (!calendarService.isStillOpen(turn.slot, proposal, turn.now)) {
            turn.say(phrases.slotNoLongerAvailable(turn.lang()));
            offerSlots(turn);
            return;
        }
        turn.session.setSelectedStart(proposal.start());
        turn.session.setState(SessionState.AWAITING_CONFIRMATION);
        promptConfirmation(turn);
    }

    // =========================================================
    // CONFIRMATION
    // =========================================================
    private void promptConfirmation(Turn turn) {
        ConversationSession session = turn.session;
        turn.say(phrases.confirmationPrompt(turn.lang(),
                phrases.categoryLabel(turn.lang(), session.getCategory()),
                session.getDurationMinutes(),
                session.getExtras(),
                session.getTotalPriceMinor(),
                session.getSelectedStart(),
                turn.zone,
                turn.slot.getApproximateAddress()));
    }

    private void onConfirmation(Turn turn, String body) {
        OptionalInt n = parseNumber(body);
        if (n.isPresent()) {
            // no numbered list belongs to this step
            resolve(turn, n.getAsInt());
        }
        switch (yesNoClassifier.classify(body)) {
            case YES:
                commit(turn);
                break;
            case NO:
                offerSlots(turn);
                break;
            default:
                turn.say(phrases.confirmationReminder(turn.lang()));
                break;
        }
    }

    private void commit(Turn turn) {
        ConversationSession session = turn.session;
        BookingResult result = bookingArbiter.commitAppointment(BookingRequest.builder()
                .slotId(turn.slot.getId())
                .start(session.getSelectedStart())
                .durationMinutes(session.getDurationMinutes())
                .clientPhone(session.getClientPhone())
                .category(session.getCategory())
                .totalPriceMinor(session.getTotalPriceMinor())
                .sessionId(session.getId())
                .notes(session.getExtras().isEmpty() ? null : "Extras: " + String.join(", ", session.getExtras()))
                .origin(BookingOrigin.BOT)
                .build());

        if (result.success()) {
            session.setAppointmentId(result.appointment().getId());
            session.setState(SessionState.COMPLETED);
            session.setSelectionMapping(null);
            turn.say(phrases.booked(turn.lang(), session.getSelectedStart(), turn.zone, session.getTotalPriceMinor()));
            log.info("Session {} completed with appointment {}", session.getId(), result.appointment().getId());
            return;
        }
        switch (result.reason()) {
            case SLOT_TAKEN:
                turn.say(phrases.slotTaken(turn.lang()));
                break;
            case NO_LONGER_AVAILABLE:
                turn.say(phrases.slotNoLongerAvailable(turn.lang()));
                break;
            default:
                break;
        }
        offerSlots(turn);
    }

    // =========================================================
    // COMMANDS
    // =========================================================
    private void cancel(Turn turn) {
        ConversationSession session = turn.session;
        SessionState previous = session.getState();
        session.setState(SessionState.CANCELLED);
        session.setSelectionMapping(null);
        turn.say(phrases.cancelled(turn.lang()));
        log.info("Session {} cancelled by client {} in state {}", session.getId(), session.getClientPhone(), previous);
    }

    private void back(Turn turn) {
        SessionState target = turn.session.getState().previous();
        if (target == SessionState.AWAITING_EXTRAS && pricingService.activeExtras(turn.slot).isEmpty()) {
            target = SessionState.AWAITING_DURATION;
        }
        turn.session.setState(target);
        reprompt(turn);
    }

    private void reprompt(Turn turn) {
        switch (turn.session.getState()) {
            case AWAITING_DURATION:
                promptDuration(turn);
                break;
            case AWAITING_EXTRAS:
                promptExtras(turn);
                break;
            case AWAITING_SLOT_CHOICE:
                offerSlots(turn);
                break;
            case AWAITING_CONFIRMATION:
                promptConfirmation(turn);
                break;
            case AWAITING_CATEGORY:
            default:
                promptCategory(turn);
                break;
        }
    }

    private String priceList(Turn turn) {
        List<String> tiers = pricingService.sellableTiers(turn.slot).stream()
                .map(t -> phrases.categoryLabel(turn.lang(), t.getCategory()) + " "
                        + ResponsePhrases.durationLabel(t.getDurationMinutes()) + " : "
                        + ResponsePhrases.formatPrice(t.getPriceMinor()))
                .collect(Collectors.toList());
        List<String> extras = pricingService.activeExtras(turn.slot).stream()
                .map(e -> phrases.extraOption(e.getName(), e.getPriceMinor()))
                .collect(Collectors.toList());
        return phrases.priceList(turn.lang(), tiers, extras);
    }

    private String recap(Turn turn) {
        ConversationSession session = turn.session;
        return phrases.recap(turn.lang(),
                session.getCategory() != null ? phrases.categoryLabel(turn.lang(), session.getCategory()) : null,
                session.getDurationMinutes(),
                session.getExtras(),
                session.getTotalPriceMinor(),
                session.getSelectedStart() != null ? phrases.formatStart(turn.lang(), session.getSelectedStart(), turn.zone) : null);
    }

    // =========================================================
    // SELECTION MAPPING
    // =========================================================
    /**
     * Shows a new numbered list: the generation moves on, so numbers typed against any
     * earlier list no longer resolve.
     */
    private void issue(Turn turn, SessionState state, Map<Integer, String> options) {
        ConversationSession session = turn.session;
        int generation = session.getGeneration() + 1;
        session.setState(state);
        session.setGeneration(generation);
        session.setSelectionMapping(new SelectionMapping(state, generation, turn.now, options));
    }

    private String resolve(Turn turn, int ordinal) {
        ConversationSession session = turn.session;
        SelectionMapping mapping = session.getSelectionMapping();
        if (mapping == null || !mapping.isValidFor(session.getState(), session.getGeneration())) {
            throw new SessionException(SessionError.STALE_MAPPING);
        }
        if (session.getState() == SessionState.AWAITING_SLOT_CHOICE
                && mapping.isOlderThan(properties.getSlotChoiceTtl(), turn.now)) {
            throw new SessionException(SessionError.STALE_MAPPING);
        }
        return mapping.resolve(ordinal);
    }

    private static void applyQuote(ConversationSession session, PriceQuote quote) {
        session.setBasePriceMinor(quote.basePriceMinor());
        session.setExtras(new ArrayList<>(quote.extras()));
        session.setExtrasTotalMinor(quote.extrasTotalMinor());
    }

    // =========================================================
    // PARSING
    // =========================================================
    static OptionalInt parseNumber(String body) {
        Matcher m = NUMBER.matcher(StringUtils.trimToEmpty(body));
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    static Integer parseDurationLiteral(String body) {
        String t = StringUtils.trimToEmpty(body).toLowerCase();
        Matcher h = HOURS.matcher(t);
        if (h.matches()) {
            int minutes = Integer.parseInt(h.group(1)) * 60;
            if (h.group(2) != null) minutes += Integer.parseInt(h.group(2));
            return minutes > 0 ? minutes : null;
        }
        Matcher m = MINUTES.matcher(t);
        if (m.matches()) {
            int minutes = Integer.parseInt(m.group(1));
            return minutes > 0 ? minutes : null;
        }
        return null;
    }

    static Optional<PricingCategory> categoryKeyword(String body) {
        if (StringUtils.isBlank(body)) return Optional.empty();
        boolean outcall = OUTCALL.matcher(body).find();
        boolean incall = PRIVATE.matcher(body).find();
        if (outcall == incall) return Optional.empty();
        return Optional.of(outcall ? PricingCategory.OUTCALL : PricingCategory.PRIVATE);
    }

    /**
     * Mutable context of one turn; the reply is assembled from the phrases said along the way.
     */
    private static final class Turn {

        private final ConversationSession session;
        private final Slot slot;
        private final ZoneId zone;
        private final Instant now;
        private final List<String> lines = new ArrayList<>();

        private Turn(ConversationSession session, Slot slot, ZoneId zone, Instant now) {
            this.session = session;
            this.slot = slot;
            this.zone = zone;
            this.now = now;
        }

        private String lang() {
            return session.getLanguage() != null ? session.getLanguage() : LanguageDetector.FRENCH;
        }

        private void say(String line) {
            lines.add(line);
        }

        private String text() {
            return String.join("\n\n", lines);
        }
    }
}
