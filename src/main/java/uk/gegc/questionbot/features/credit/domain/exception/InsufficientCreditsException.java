package uk.gegc.questionbot.features.credit.domain.exception;

import java.util.UUID;

public class InsufficientCreditsException extends RuntimeException {

    private final UUID accountId;

    public InsufficientCreditsException(UUID accountId) {
        super("Account " + accountId + " has no credits left");
        this.accountId = accountId;
    }

    public UUID getAccountId() {
        return accountId;
    }
}
