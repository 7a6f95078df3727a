package uk.gegc.questionbot.features.credit.domain.model;

public enum MergeOutcome {
    /**
     * No account carried the chat identity; it was bound to the web account.
     */
    BOUND,
    /**
     * The chat identity was already bound to the web account.
     */
    ALREADY_LINKED,
    /**
     * A placeholder account was absorbed into the web account.
     */
    MERGED
}
