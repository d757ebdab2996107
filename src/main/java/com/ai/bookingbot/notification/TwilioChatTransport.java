package com.ai.bookingbot.notification;

import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Sends WhatsApp messages through the Twilio REST API. Without credentials every send is
 * logged and skipped.
 */
@Service
public class TwilioChatTransport implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(TwilioChatTransport.class);

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final String accountSid;
    private final String authToken;
    private final String defaultFrom;

    private volatile boolean initialized;

    public TwilioChatTransport(@Value("${twilio.accountSid:${twilio.account-sid:}}") String accountSid,
                               @Value("${twilio.authToken:${twilio.auth-token:}}") String authToken,
                               @Value("${twilio.whatsapp-from:}") String defaultFrom) {
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.defaultFrom = defaultFrom;
    }

    @Override
    public boolean send(String fromNumber, String toPhone, String text) {
        if (StringUtils.isAnyBlank(toPhone, text)) {
            return false;
        }
        if (StringUtils.isAnyBlank(accountSid, authToken)) {
            log.warn("Twilio credentials not set; skipping message to {}", toPhone);
            return false;
        }
        String from = StringUtils.defaultIfBlank(fromNumber, defaultFrom);
        if (StringUtils.isBlank(from)) {
            log.warn("No sender number for message to {}", toPhone);
            return false;
        }
        init();
        try {
            Message message = Message.creator(whatsapp(toPhone), whatsapp(from), text).create();
            log.info("Sent WhatsApp message sid={} to {}", message.getSid(), toPhone);
            return true;
        } catch (ApiException e) {
            log.error("Twilio send failed to {}: {}", toPhone, e.getMessage(), e);
            return false;
        }
    }

    private void init() {
        if (!initialized) {
            synchronized (this) {
                if (!initialized) {
                    Twilio.init(accountSid, authToken);
                    initialized = true;
                }
            }
        }
    }

    private static PhoneNumber whatsapp(String number) {
        String n = number.trim();
        if (!n.startsWith(WHATSAPP_PREFIX)) {
            n = WHATSAPP_PREFIX + (n.startsWith("+") ? n : "+" + n);
        }
        return new PhoneNumber(n);
    }
}
