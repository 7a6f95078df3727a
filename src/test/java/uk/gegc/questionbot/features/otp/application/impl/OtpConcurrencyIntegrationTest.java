package uk.gegc.questionbot.features.otp.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.questionbot.BaseIntegrationTest;
import uk.gegc.questionbot.features.otp.application.OtpService;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OtpService under concurrent verification")
class OtpConcurrencyIntegrationTest extends BaseIntegrationTest {

    private static final int THREADS = 6;

    @Autowired
    private OtpService otpService;

    @Test
    @DisplayName("concurrent submissions of one valid code: exactly one succeeds")
    void concurrentVerify_exactlyOneSucceeds() throws Exception {
        String code = otpService.issue("race@example.com");

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return otpService.verify("race@example.com", code);
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(30, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        Integer used = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM one_time_passcodes WHERE email = ? AND used = TRUE", Integer.class,
                "race@example.com");
        assertThat(used).isEqualTo(1);
    }
}
