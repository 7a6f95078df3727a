package uk.gegc.questionbot.features.otp.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.questionbot.features.otp.application.OtpProperties;
import uk.gegc.questionbot.features.otp.application.OtpService;
import uk.gegc.questionbot.features.otp.domain.exception.PasscodeDeliveryException;
import uk.gegc.questionbot.features.otp.domain.model.OneTimePasscode;
import uk.gegc.questionbot.features.otp.domain.repository.OneTimePasscodeRepository;
import uk.gegc.questionbot.shared.email.EmailService;
import uk.gegc.questionbot.shared.util.EmailAddresses;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;

import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

@Slf4j
@Service
@RequiredArgsConstructor
public class OtpServiceImpl implements OtpService {

    private static final int CODE_BOUND = 1_000_000;

    private final OneTimePasscodeRepository passcodeRepository;
    private final EmailService emailService;
    private final OtpProperties otpProperties;
    private final MeterRegistry meterRegistry;
    @Qualifier("utcClock")
    private final Clock utcClock;

    private final SecureRandom random = new SecureRandom();

    @PostConstruct
    void verifyPepper() {
        if (otpProperties.getPepper() == null || otpProperties.getPepper().isBlank()) {
            throw new IllegalStateException("app.otp.pepper is not configured");
        }
    }

    @Override
    public String issue(String email) {
        String normalized = EmailAddresses.normalize(email);
        String code = String.format("%06d", random.nextInt(CODE_BOUND));

        LocalDateTime now = LocalDateTime.now(utcClock);
        OneTimePasscode passcode = new OneTimePasscode();
        passcode.setEmail(normalized);
        passcode.setCodeHash(hashPasscode(code));
        passcode.setIssuedAt(now);
        passcode.setExpiresAt(now.plusMinutes(otpProperties.getTtlMinutes()));
        passcodeRepository.save(passcode);

        meterRegistry.counter("otp.issued").increment();
        log.info("Issued passcode for {} expiring at {}", maskEmail(normalized), passcode.getExpiresAt());
        return code;
    }

    @Override
    public void issueAndSend(String email) {
        String code;
        try {
            code = issue(email);
        } catch (RuntimeException e) {
            log.error("Failed to store passcode for {}", maskEmail(email), e);
            throw new PasscodeDeliveryException("Could not store passcode", e);
        }

        boolean sent;
        try {
            sent = emailService.sendLinkPasscodeEmail(EmailAddresses.normalize(email), code);
        } catch (RuntimeException e) {
            log.error("Email provider threw while sending passcode to {}", maskEmail(email), e);
            throw new PasscodeDeliveryException("Could not send passcode", e);
        }
        if (!sent) {
            log.warn("Email provider rejected passcode for {}", maskEmail(email));
            throw new PasscodeDeliveryException("Could not send passcode");
        }
    }

    @Override
    public boolean verify(String email, String code) {
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null || code == null) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(utcClock);

        List<OneTimePasscode> candidates = passcodeRepository.findRedeemable(normalized, hashPasscode(code), now);
        if (candidates.isEmpty()) {
            log.info("No redeemable passcode for {}", maskEmail(normalized));
            meterRegistry.counter("otp.verified", "outcome", "rejected").increment();
            return false;
        }

        OneTimePasscode newest = candidates.get(0);
        boolean consumed = passcodeRepository.markUsedIfValid(newest.getId(), now) == 1;
        meterRegistry.counter("otp.verified", "outcome", consumed ? "accepted" : "raced").increment();
        if (!consumed) {
            log.info("Passcode for {} was consumed concurrently or expired", maskEmail(normalized));
        }
        return consumed;
    }

    @Override
    public int purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(utcClock).minusHours(otpProperties.getRetentionHours());
        int deleted = passcodeRepository.deleteExpiredBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} passcodes expired before {}", deleted, cutoff);
        }
        return deleted;
    }

    private String hashPasscode(String code) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((otpProperties.getPepper() + code).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
