package uk.gegc.questionbot.shared.email.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NoopEmailService")
class NoopEmailServiceTest {

    private final NoopEmailService emailService = new NoopEmailService();

    @Test
    @DisplayName("reports the passcode send as delivered")
    void sends_reportDelivered() {
        assertThat(emailService.sendLinkPasscodeEmail("bob@example.com", "123456")).isTrue();
    }
}
