package uk.gegc.questionbot.features.otp.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * One-time passcode settings.
 */
@Configuration
@ConfigurationProperties(prefix = "app.otp")
@Validated
@Data
public class OtpProperties {

    /**
     * Lifetime of an issued passcode in minutes.
     */
    @Positive
    private long ttlMinutes = 10;

    /**
     * Secret mixed into the stored passcode hash.
     */
    @NotBlank
    private String pepper;

    /**
     * How long expired records are kept before housekeeping deletes them.
     */
    @Positive
    private long retentionHours = 24;
}
