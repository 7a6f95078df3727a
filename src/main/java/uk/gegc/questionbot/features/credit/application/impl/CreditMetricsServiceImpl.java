package uk.gegc.questionbot.features.credit.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.questionbot.features.credit.application.CreditMetricsService;
import uk.gegc.questionbot.features.credit.domain.model.CreditPool;
import uk.gegc.questionbot.features.credit.domain.model.MergeOutcome;

import java.util.Locale;

@Service
public class CreditMetricsServiceImpl implements CreditMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter insufficientCreditsCounter;
    private final Counter creditsToppedUpCounter;
    private final Counter creditsMovedCounter;

    public CreditMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.insufficientCreditsCounter = Counter.builder("credits.insufficient")
                .description("Spend attempts rejected for lack of credits")
                .register(meterRegistry);
        this.creditsToppedUpCounter = Counter.builder("credits.topped_up")
                .description("Paid credits added by the payment side")
                .register(meterRegistry);
        this.creditsMovedCounter = Counter.builder("credits.merged.moved")
                .description("Credits moved from placeholder accounts into web accounts")
                .register(meterRegistry);
    }

    @Override
    public void recordSpend(CreditPool pool) {
        Counter.builder("credits.spent")
                .description("Credits spent on question sets")
                .tag("pool", pool.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordInsufficientCredits() {
        insufficientCreditsCounter.increment();
    }

    @Override
    public void recordMerge(MergeOutcome outcome, int movedFree, int movedPaid) {
        Counter.builder("credits.merged")
                .description("Chat identities linked to web accounts")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        if (movedFree + movedPaid > 0) {
            creditsMovedCounter.increment(movedFree + movedPaid);
        }
    }

    @Override
    public void recordTopUp(int credits) {
        creditsToppedUpCounter.increment(credits);
    }
}
