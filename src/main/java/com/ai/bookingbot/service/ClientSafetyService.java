package com.ai.bookingbot.service;

import com.ai.bookingbot.entity.BlacklistEntry;
import com.ai.bookingbot.repository.BlacklistEntryRepository;
import com.ai.bookingbot.repository.ClientBlockRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-mostly lookups over the shared blacklist and the per-provider client blocks.
 */
@Service
public class ClientSafetyService {

    private static final Logger log = LoggerFactory.getLogger(ClientSafetyService.class);

    private final BlacklistEntryRepository blacklistRepository;
    private final ClientBlockRepository clientBlockRepository;

    public ClientSafetyService(BlacklistEntryRepository blacklistRepository,
                               ClientBlockRepository clientBlockRepository) {
        this.blacklistRepository = blacklistRepository;
        this.clientBlockRepository = clientBlockRepository;
    }

    /**
     * Digits only: drops a {@code whatsapp:} prefix, spaces, dashes and the leading plus.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) return "";
        String p = StringUtils.removeStartIgnoreCase(phone.trim(), "whatsapp:");
        return p.replaceAll("[^0-9]", "");
    }

    @Transactional(readOnly = true)
    public boolean isBlacklisted(String phone) {
        String normalized = normalizePhone(phone);
        return !normalized.isEmpty() && blacklistRepository.existsByPhone(normalized);
    }

    @Transactional(readOnly = true)
    public boolean isBlockedByProvider(Long providerId, String phone) {
        String normalized = normalizePhone(phone);
        return !normalized.isEmpty() && clientBlockRepository.existsByProviderIdAndPhone(providerId, normalized);
    }

    /**
     * Creates the shared entry or increments its report count.
     */
    @Transactional
    public BlacklistEntry report(Long providerId, String phone, String reason) {
        String normalized = normalizePhone(phone);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Cannot report an empty phone number");
        }
        BlacklistEntry entry = blacklistRepository.findByPhone(normalized)
                .map(existing -> {
                    existing.setReportCount(existing.getReportCount() + 1);
                    return existing;
                })
                .orElseGet(() -> BlacklistEntry.builder()
                        .phone(normalized)
                        .reportedBy(providerId)
                        .reason(reason)
                        .build());
        entry = blacklistRepository.save(entry);
        log.info("Client {} reported by provider {} (count={})", normalized, providerId, entry.getReportCount());
        return entry;
    }
}
