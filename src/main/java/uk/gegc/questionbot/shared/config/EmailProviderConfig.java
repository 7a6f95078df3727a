package uk.gegc.questionbot.shared.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import uk.gegc.questionbot.shared.email.EmailService;
import uk.gegc.questionbot.shared.email.impl.AwsSesEmailService;
import uk.gegc.questionbot.shared.email.impl.NoopEmailService;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}.
 * <ul>
 *     <li>{@code ses}: AWS SES via HTTPS API</li>
 *     <li>{@code noop}: log only (default)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "ses")
    public EmailService awsSesEmailService(SesV2Client sesV2Client,
                                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        log.info("Activating AWS SES email service");
        return new AwsSesEmailService(sesV2Client, meterRegistryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
