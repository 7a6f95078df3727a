package uk.gegc.questionbot.features.otp.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.questionbot.features.otp.application.OtpProperties;
import uk.gegc.questionbot.features.otp.domain.exception.PasscodeDeliveryException;
import uk.gegc.questionbot.features.otp.domain.model.OneTimePasscode;
import uk.gegc.questionbot.features.otp.domain.repository.OneTimePasscodeRepository;
import uk.gegc.questionbot.shared.email.EmailService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OtpServiceImpl")
class OtpServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private OneTimePasscodeRepository passcodeRepository;

    @Mock
    private EmailService emailService;

    private SimpleMeterRegistry meterRegistry;
    private OtpServiceImpl otpService;

    @BeforeEach
    void setUp() {
        OtpProperties properties = new OtpProperties();
        properties.setPepper("pepper");
        properties.setTtlMinutes(10);
        properties.setRetentionHours(24);
        meterRegistry = new SimpleMeterRegistry();
        otpService = new OtpServiceImpl(passcodeRepository, emailService, properties, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        @DisplayName("stores a hashed 6-digit code for the normalised email with a 10 minute expiry")
        void issue_storesHashedCode() {
            String code = otpService.issue("  Bob@Example.com ");

            ArgumentCaptor<OneTimePasscode> captor = ArgumentCaptor.forClass(OneTimePasscode.class);
            verify(passcodeRepository).save(captor.capture());
            OneTimePasscode stored = captor.getValue();

            assertThat(code).matches("[0-9]{6}");
            assertThat(stored.getEmail()).isEqualTo("bob@example.com");
            assertThat(stored.getCodeHash()).isNotEqualTo(code).hasSize(44);
            assertThat(stored.getIssuedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
            assertThat(stored.getExpiresAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 10));
            assertThat(stored.isUsed()).isFalse();
            assertThat(meterRegistry.counter("otp.issued").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("issueAndSend")
    class IssueAndSend {

        @Test
        @DisplayName("emails the issued code")
        void issueAndSend_sendsCode() {
            when(emailService.sendLinkPasscodeEmail(eq("bob@example.com"), anyString())).thenReturn(true);

            otpService.issueAndSend("bob@example.com");

            ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
            verify(emailService).sendLinkPasscodeEmail(eq("bob@example.com"), code.capture());
            assertThat(code.getValue()).matches("[0-9]{6}");
        }

        @Test
        @DisplayName("rejected delivery surfaces as PasscodeDeliveryException")
        void issueAndSend_providerRejects_throws() {
            when(emailService.sendLinkPasscodeEmail(anyString(), anyString())).thenReturn(false);

            assertThatThrownBy(() -> otpService.issueAndSend("bob@example.com"))
                    .isInstanceOf(PasscodeDeliveryException.class);
        }

        @Test
        @DisplayName("store failure surfaces as PasscodeDeliveryException and nothing is sent")
        void issueAndSend_storeFails_throws() {
            when(passcodeRepository.save(any(OneTimePasscode.class))).thenThrow(new IllegalStateException("db down"));

            assertThatThrownBy(() -> otpService.issueAndSend("bob@example.com"))
                    .isInstanceOf(PasscodeDeliveryException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            verify(emailService, never()).sendLinkPasscodeEmail(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("consumes the newest matching record")
        void verify_match_consumes() {
            OneTimePasscode newest = passcode();
            when(passcodeRepository.findRedeemable(eq("bob@example.com"), anyString(), eq(LocalDateTime.of(2024, 1, 1, 12, 0))))
                    .thenReturn(List.of(newest, passcode()));
            when(passcodeRepository.markUsedIfValid(newest.getId(), LocalDateTime.of(2024, 1, 1, 12, 0))).thenReturn(1);

            assertThat(otpService.verify("Bob@example.com", "123456")).isTrue();
            assertThat(meterRegistry.counter("otp.verified", "outcome", "accepted").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("no matching record fails without touching the store")
        void verify_noMatch_fails() {
            when(passcodeRepository.findRedeemable(anyString(), anyString(), any())).thenReturn(List.of());

            assertThat(otpService.verify("bob@example.com", "000000")).isFalse();
            verify(passcodeRepository, never()).markUsedIfValid(any(), any());
        }

        @Test
        @DisplayName("losing the conditional update to a concurrent caller fails")
        void verify_lostRace_fails() {
            OneTimePasscode record = passcode();
            when(passcodeRepository.findRedeemable(anyString(), anyString(), any())).thenReturn(List.of(record));
            when(passcodeRepository.markUsedIfValid(eq(record.getId()), any())).thenReturn(0);

            assertThat(otpService.verify("bob@example.com", "123456")).isFalse();
            assertThat(meterRegistry.counter("otp.verified", "outcome", "raced").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("the same code hashes identically on issue and verify")
        void verify_usesSameHashAsIssue() {
            String code = otpService.issue("bob@example.com");
            ArgumentCaptor<OneTimePasscode> stored = ArgumentCaptor.forClass(OneTimePasscode.class);
            verify(passcodeRepository).save(stored.capture());

            when(passcodeRepository.findRedeemable(anyString(), anyString(), any())).thenReturn(List.of());
            otpService.verify("bob@example.com", code);

            verify(passcodeRepository).findRedeemable(eq("bob@example.com"), eq(stored.getValue().getCodeHash()), any());
        }

        @Test
        @DisplayName("null inputs fail")
        void verify_nulls_fail() {
            assertThat(otpService.verify(null, "123456")).isFalse();
            assertThat(otpService.verify("bob@example.com", null)).isFalse();
        }
    }

    @Test
    @DisplayName("purgeExpired deletes records older than the retention window")
    void purgeExpired_usesRetentionCutoff() {
        when(passcodeRepository.deleteExpiredBefore(LocalDateTime.of(2023, 12, 31, 12, 0))).thenReturn(3);

        assertThat(otpService.purgeExpired()).isEqualTo(3);
    }

    @Test
    @DisplayName("a missing pepper fails startup")
    void verifyPepper_blank_fails() {
        OtpProperties properties = new OtpProperties();
        properties.setPepper(" ");
        OtpServiceImpl unconfigured = new OtpServiceImpl(passcodeRepository, emailService, properties,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(unconfigured::verifyPepper).isInstanceOf(IllegalStateException.class);
    }

    private static OneTimePasscode passcode() {
        OneTimePasscode passcode = new OneTimePasscode();
        passcode.setId(UUID.randomUUID());
        passcode.setEmail("bob@example.com");
        return passcode;
    }
}
