package uk.gegc.questionbot.features.credit.domain.model;

public enum CreditTransactionType {
    SPEND,
    MERGE_IN,
    MERGE_OUT,
    TOP_UP
}
