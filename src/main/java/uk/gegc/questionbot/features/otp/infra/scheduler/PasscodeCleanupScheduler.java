package uk.gegc.questionbot.features.otp.infra.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.questionbot.features.otp.application.OtpService;

@Slf4j
@Component
@RequiredArgsConstructor
public class PasscodeCleanupScheduler {

    private final OtpService otpService;

    @Scheduled(cron = "${app.otp.cleanup-cron:0 15 * * * *}")
    public void purgeExpiredPasscodes() {
        try {
            otpService.purgeExpired();
            log.debug("Expired passcode cleanup completed");
        } catch (Exception e) {
            // Housekeeping only; the next run retries
            log.error("Failed to clean up expired passcodes", e);
        }
    }
}
