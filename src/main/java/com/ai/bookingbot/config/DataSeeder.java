package com.ai.bookingbot.config;

import com.ai.bookingbot.entity.BusinessHours;
import com.ai.bookingbot.entity.Extra;
import com.ai.bookingbot.entity.PricingCategory;
import com.ai.bookingbot.entity.PricingTier;
import com.ai.bookingbot.entity.Provider;
import com.ai.bookingbot.entity.Slot;
import com.ai.bookingbot.repository.BusinessHoursRepository;
import com.ai.bookingbot.repository.ExtraRepository;
import com.ai.bookingbot.repository.PricingTierRepository;
import com.ai.bookingbot.repository.ProviderRepository;
import com.ai.bookingbot.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Demo provider with one slot: weekday hours, private and outcall tiers, two extras.
 */
@Configuration
@ConditionalOnProperty(name = "booking.seed-demo-data", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final int[] PRIVATE_DURATIONS = {15, 30, 45, 60, 90, 120};
    private static final long[] PRIVATE_PRICES = {5000, 8000, 11000, 13000, 19000, 25000};
    private static final int[] OUTCALL_DURATIONS = {60, 90, 120};
    private static final long[] OUTCALL_PRICES = {18000, 25000, 32000};

    @Bean
    CommandLineRunner seedData(ProviderRepository providerRepo,
                               SlotRepository slotRepo,
                               BusinessHoursRepository hoursRepo,
                               PricingTierRepository tierRepo,
                               ExtraRepository extraRepo) {
        return args -> {
            if (providerRepo.count() > 0) {
                log.info("Providers already seeded, skipping");
                return;
            }

            Provider provider = providerRepo.save(Provider.builder()
                    .businessName("Studio Demo")
                    .phone("+32470000000")
                    .city("Bruxelles")
                    .timeZone("Europe/Brussels")
                    .build());

            slotRepo.save(Slot.builder()
                    .provider(provider)
                    .name("Demo")
                    .contactPhone("+32470000001")
                    .whatsappNumber("+14155238886")
                    .approximateAddress("Bruxelles, Ixelles")
                    .exactAddress("Rue de la Demo 1, 1050 Ixelles")
                    .build());

            List<BusinessHours> hours = new ArrayList<>();
            for (int day = 0; day <= 6; day++) {
                boolean weekend = day == 0 || day == 6;
                hours.add(BusinessHours.builder()
                        .provider(provider)
                        .dayOfWeek(day)
                        .openTime(LocalTime.of(10, 0))
                        .closeTime(LocalTime.of(22, 0))
                        .closed(weekend)
                        .build());
            }
            hoursRepo.saveAll(hours);

            List<PricingTier> tiers = new ArrayList<>();
            for (int i = 0; i < PRIVATE_DURATIONS.length; i++) {
                tiers.add(tier(provider, PRIVATE_DURATIONS[i], PricingCategory.PRIVATE, PRIVATE_PRICES[i]));
            }
            for (int i = 0; i < OUTCALL_DURATIONS.length; i++) {
                tiers.add(tier(provider, OUTCALL_DURATIONS[i], PricingCategory.OUTCALL, OUTCALL_PRICES[i]));
            }
            tierRepo.saveAll(tiers);

            extraRepo.save(Extra.builder().provider(provider).name("Massage").priceMinor(3000).build());
            extraRepo.save(Extra.builder().provider(provider).name("Champagne").priceMinor(5000).custom(true).build());

            log.info("Seeded demo provider id={} with {} tiers", provider.getId(), tiers.size());
        };
    }

    private static PricingTier tier(Provider provider, int duration, PricingCategory category, long price) {
        return PricingTier.builder()
                .provider(provider)
                .durationMinutes(duration)
                .category(category)
                .priceMinor(price)
                .build();
    }
}
