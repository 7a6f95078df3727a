package uk.gegc.questionbot.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for the application.
 * <p>
 * Credit timestamps and passcode expiry are always computed from the {@code utcClock} bean so tests can
 * substitute a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    @Primary
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }

    @Bean("utcClock")
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
