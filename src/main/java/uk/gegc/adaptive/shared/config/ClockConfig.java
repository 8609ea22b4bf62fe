package uk.gegc.adaptive.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

/**
 * Single source of time and randomness for the engine.
 * Tests replace both with fixed clocks and seeded generators.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }

    /**
     * Randomness used for selection tiebreaks and presentation-order shuffles.
     */
    @Bean
    public Random selectionRandom() {
        return new SecureRandom();
    }
}
