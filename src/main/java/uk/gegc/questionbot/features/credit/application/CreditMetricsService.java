package uk.gegc.questionbot.features.credit.application;

import uk.gegc.questionbot.features.credit.domain.model.CreditPool;
import uk.gegc.questionbot.features.credit.domain.model.MergeOutcome;

/**
 * Micrometer counters for credit movements.
 */
public interface CreditMetricsService {

    void recordSpend(CreditPool pool);

    void recordInsufficientCredits();

    void recordMerge(MergeOutcome outcome, int movedFree, int movedPaid);

    void recordTopUp(int credits);
}
