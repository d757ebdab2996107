package com.ai.bookingbot;

import com.ai.bookingbot.entity.BusinessHours;
import com.ai.bookingbot.entity.Extra;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.entity.PricingTier;
import com.ai.bookingbot.entity.Provider;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.repository.AppointmentRepository;
import com.ai.bookingbot.repository.BlacklistEntryRepository;
import com.ai.bookingbot.repository.BlockedRangeRepository;
import com.ai.bookingbot.repository.BusinessHoursRepository;
import com.ai.bookingbot.repository.ClientBlockRepository;
import com.ai.bookingbot.repository.ConversationMessageRepository;
import com.ai.bookingbot.repository.ConversationSessionRepository;
import com.ai.bookingbot.repository.ExtraRepository;
import com.ai.bookingbot.repository.PricingTierRepository;
import com.ai.bookingbot.repository.ProviderRepository;
import com.ai.bookingbot.repository.SlotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.BDDMockito.given;

/**
 * Full context on H2 with one provider open 09:00-17:00 UTC every day and a clock the test moves.
 * The clock starts on Monday 2026-10-19 08:00 UTC.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    protected static final Instant MONDAY_8AM = Instant.parse("2026-10-19T08:00:00Z");

    @MockBean
    protected Clock clock;

    @Autowired
    protected ProviderRepository providerRepository;
    @Autowired
    protected SlotRepository slotRepository;
    @Autowired
    protected BusinessHoursRepository businessHoursRepository;
    @Autowired
    protected PricingTierRepository pricingTierRepository;
    @Autowired
    protected ExtraRepository extraRepository;
    @Autowired
    protected AppointmentRepository appointmentRepository;
    @Autowired
    protected BlockedRangeRepository blockedRangeRepository;
    @Autowired
    protected ClientBlockRepository clientBlockRepository;
    @Autowired
    protected BlacklistEntryRepository blacklistEntryRepository;
    @Autowired
    protected ConversationSessionRepository sessionRepository;
    @Autowired
    protected ConversationMessageRepository messageRepository;

    protected final AtomicReference<Instant> now = new AtomicReference<>(MONDAY_8AM);

    protected Provider provider;
    protected Slot slot;

    @BeforeEach
    void resetData() {
        messageRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        appointmentRepository.deleteAllInBatch();
        blockedRangeRepository.deleteAllInBatch();
        businessHoursRepository.deleteAllInBatch();
        pricingTierRepository.deleteAllInBatch();
        extraRepository.deleteAllInBatch();
        clientBlockRepository.deleteAllInBatch();
        blacklistEntryRepository.deleteAllInBatch();
        slotRepository.deleteAllInBatch();
        providerRepository.deleteAllInBatch();

        now.set(MONDAY_8AM);
        given(clock.instant()).willAnswer(inv -> now.get());

        provider = providerRepository.save(Provider.builder()
                .businessName("Studio Test")
                .timeZone("UTC")
                .build());
        slot = slotRepository.save(Slot.builder()
                .provider(provider)
                .name("Test")
                .whatsappNumber("+15550001111")
                .approximateAddress("Ixelles")
                .build());
        for (int day = 0; day <= 6; day++) {
            businessHoursRepository.save(BusinessHours.builder()
                    .provider(provider)
                    .dayOfWeek(day)
                    .openTime(LocalTime.of(9, 0))
                    .closeTime(LocalTime.of(17, 0))
                    .build());
        }
        tier(30, PricingCategory.PRIVATE, 8000);
        tier(60, PricingCategory.PRIVATE, 13000);
        tier(45, PricingCategory.OUTCALL, 12000);
        tier(60, PricingCategory.OUTCALL, 18000);
        extraRepository.save(Extra.builder().provider(provider).name("Massage").priceMinor(3000).build());
        extraRepository.save(Extra.builder().provider(provider).name("Old").priceMinor(1000).active(false).build());
    }

    protected void advance(Duration duration) {
        now.set(now.get().plus(duration));
    }

    private void tier(int minutes, PricingCategory category, long priceMinor) {
        pricingTierRepository.save(PricingTier.builder()
                .provider(provider)
                .durationMinutes(minutes)
                .category(category)
                .priceMinor(priceMinor)
                .build());
    }
}
