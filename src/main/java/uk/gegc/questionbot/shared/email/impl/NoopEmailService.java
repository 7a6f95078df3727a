package uk.gegc.questionbot.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.questionbot.shared.email.EmailService;

import static uk.gegc.questionbot.shared.util.LogMasking.maskCode;
import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

/**
 * No-op email service for local development and tests.
 * <p>
 * Logs send attempts and reports them as delivered. Activated when {@code app.email.provider=noop}
 * (the default).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public boolean sendLinkPasscodeEmail(String email, String passcode) {
        log.info("[NOOP] Would send link passcode to: {} with code: {}", maskEmail(email), maskCode(passcode));
        return true;
    }
}
