package com.ai.bookingbot.dto;

import com.ai.bookingbot.conversation.SessionState;
import com.ai.bookingbot.entity.ConversationSession;
import com.ai.bookingbot.entity.PricingCategory;

import java.time.Instant;
import java.util.List;

public record SessionSummaryDto(Long id,
                                Long slotId,
                                String clientPhone,
                                SessionState state,
                                PricingCategory category,
                                Integer durationMinutes,
                                List<String> extras,
                                long totalPriceMinor,
                                Instant selectedStart,
                                String language,
                                Instant lastUpdate) {

    public static SessionSummaryDto from(ConversationSession s) {
        return new SessionSummaryDto(s.getId(), s.getSlotId(), s.getClientPhone(), s.getState(), s.getCategory(),
                s.getDurationMinutes(), List.copyOf(s.getExtras()), s.getTotalPriceMinor(), s.getSelectedStart(),
                s.getLanguage(), s.getLastUpdate());
    }
}
