package com.ai.bookingbot.controller;

import com.ai.bookingbot.conversation.InboundMessage;
import com.ai.bookingbot.dto.TurnReply;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.service.ConversationService;
import com.ai.bookingbot.service.SlotConfigurationService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Twilio WhatsApp webhook. The slot is found by the number the client wrote to; the reply
 * goes back inline as TwiML.
 */
@RestController
public class TwilioWhatsAppController {

    private static final Logger log = LoggerFactory.getLogger(TwilioWhatsAppController.class);

    private static final String EMPTY_RESPONSE = "<Response/>";

    private final SlotConfigurationService configuration;
    private final ConversationService conversationService;

    public TwilioWhatsAppController(SlotConfigurationService configuration, ConversationService conversationService) {
        this.configuration = configuration;
        this.conversationService = conversationService;
    }

    @PostMapping(value = "/twilio/whatsapp/inbound", produces = "application/xml;charset=UTF-8")
    public ResponseEntity<String> inbound(@RequestParam(required = false) Map<String, String> params) {
        String from = stripChannel(params != null ? params.get("From") : null);
        String to = stripChannel(params != null ? params.get("To") : null);
        String body = params != null ? params.getOrDefault("Body", "") : "";
        if (StringUtils.isAnyBlank(from, to)) {
            log.warn("WhatsApp webhook without From/To, ignored");
            return ResponseEntity.ok(EMPTY_RESPONSE);
        }

        Optional<Slot> slot = configuration.findByWhatsappNumber(to);
        if (slot.isEmpty()) {
            log.warn("No active slot for WhatsApp number {}, message from {} ignored", to, from);
            return ResponseEntity.ok(EMPTY_RESPONSE);
        }

        TurnReply reply = conversationService.handleTurn(
                new InboundMessage(slot.get().getProvider().getId(), slot.get().getId(), from, body));
        if (reply.silent() || StringUtils.isBlank(reply.text())) {
            return ResponseEntity.ok(EMPTY_RESPONSE);
        }
        log.debug("Reply to {} session={} state={}", from, reply.sessionId(), reply.state());
        return ResponseEntity.ok("<Response><Message>" + escapeXml(reply.text()) + "</Message></Response>");
    }

    private static String stripChannel(String address) {
        if (address == null) return null;
        return StringUtils.removeStartIgnoreCase(address.trim(), "whatsapp:");
    }

    private static String escapeXml(String raw) {
        if (raw == null) return "";
        return raw
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }
}
