package uk.gegc.questionbot.shared.email.impl;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;
import uk.gegc.questionbot.shared.email.EmailService;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

/**
 * AWS SES-based email service using the SESv2 API over HTTPS.
 * <p>
 * Failures are logged with a masked recipient, counted, and reported to the caller as {@code false};
 * nothing is thrown, so the link flow can treat delivery as a single yes/no step.
 */
@Slf4j
public class AwsSesEmailService implements EmailService {

    private static final String EMAIL_TYPE_LINK_PASSCODE = "link-passcode";

    private final SesV2Client sesClient;
    private final MeterRegistry meterRegistry;

    @Value("${app.email.from}")
    private String fromEmail;

    @Value("${app.email.link-passcode.subject:Your verification code}")
    private String linkPasscodeSubject;

    @Value("${app.otp.ttl-minutes:10}")
    private long passcodeTtlMinutes;

    @Value("${app.email.ses.configuration-set:#{null}}")
    private String configurationSetName;

    @Value("${app.email.templates.link-passcode:classpath:email/link-passcode-email.txt}")
    private Resource linkPasscodeTemplateResource;

    private String linkPasscodeTemplate;

    public AwsSesEmailService(SesV2Client sesClient, MeterRegistry meterRegistry) {
        this.sesClient = sesClient;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initialize() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("AWS SES Email Service: app.email.from is not configured; sends will be rejected by SES");
        } else {
            log.info("AWS SES Email Service initialized with sender: {}", fromEmail);
        }
        this.linkPasscodeTemplate = loadTemplate(linkPasscodeTemplateResource);
    }

    private String loadTemplate(Resource resource) {
        if (resource == null) {
            throw new IllegalStateException("Missing resource for link passcode email template");
        }
        try (var inputStream = resource.getInputStream()) {
            String content = StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
            if (content == null || content.isBlank()) {
                throw new IllegalStateException("Link passcode template is empty: " + resource.getDescription());
            }
            return content;
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            log.error("Failed to load link passcode email template from resource: {}", resource.getDescription(), ex);
            throw new IllegalStateException("Cannot load link passcode email template", ex);
        }
    }

    @Override
    public boolean sendLinkPasscodeEmail(String email, String passcode) {
        String body = String.format(linkPasscodeTemplate, passcode, passcodeTtlMinutes);
        return send(email, linkPasscodeSubject, body, EMAIL_TYPE_LINK_PASSCODE);
    }

    private boolean send(String to, String subject, String body, String type) {
        try {
            SendEmailResponse response = sesClient.sendEmail(buildEmailRequest(to, subject, body));
            log.info("{} email sent to: {} | SES MessageId: {}", type, maskEmail(to), response.messageId());
            recordSuccess(type);
            return true;
        } catch (SesV2Exception e) {
            handleSesException(type, to, e);
            return false;
        } catch (Exception e) {
            log.error("Unexpected error sending {} email to: {}", type, maskEmail(to), e);
            recordFailure(type, "unexpected");
            return false;
        }
    }

    private SendEmailRequest buildEmailRequest(String toEmail, String subject, String textContent) {
        EmailContent emailContent = EmailContent.builder()
                .simple(Message.builder()
                        .subject(Content.builder()
                                .data(subject)
                                .charset("UTF-8")
                                .build())
                        .body(Body.builder()
                                .text(Content.builder()
                                        .data(textContent)
                                        .charset("UTF-8")
                                        .build())
                                .build())
                        .build())
                .build();

        SendEmailRequest.Builder requestBuilder = SendEmailRequest.builder()
                .fromEmailAddress(fromEmail)
                .destination(Destination.builder().toAddresses(toEmail).build())
                .content(emailContent);

        // The configuration set must exist in SES, otherwise the send fails
        if (configurationSetName != null && !configurationSetName.isBlank()) {
            requestBuilder.configurationSetName(configurationSetName);
        }

        return requestBuilder.build();
    }

    private void handleSesException(String type, String email, SesV2Exception e) {
        String maskedEmail = maskEmail(email);
        String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();

        if (e.statusCode() >= 400 && e.statusCode() < 500) {
            log.warn("Failed to send {} email to: {} | SES Error: {} (status: {})",
                    type, maskedEmail, detail, e.statusCode());
            recordFailure(type, "client-" + e.statusCode());
        } else if (e.statusCode() >= 500) {
            log.error("SES service error sending {} email to: {} | Error: {} (status: {})",
                    type, maskedEmail, detail, e.statusCode());
            recordFailure(type, "server-" + e.statusCode());
        } else {
            log.error("Failed to send {} email to: {} | SES Error: {}", type, maskedEmail, detail, e);
            recordFailure(type, "unknown");
        }
    }

    private void recordSuccess(String type) {
        if (meterRegistry != null) {
            meterRegistry.counter("email.sent", "provider", "ses", "type", type).increment();
        }
    }

    private void recordFailure(String type, String reason) {
        if (meterRegistry != null) {
            String sanitizedReason = reason == null ? "unknown" : reason.toLowerCase(Locale.ENGLISH);
            meterRegistry.counter("email.failed", "provider", "ses", "type", type, "reason", sanitizedReason).increment();
        }
    }
}
