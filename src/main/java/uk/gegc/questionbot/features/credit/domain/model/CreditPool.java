package uk.gegc.questionbot.features.credit.domain.model;

/**
 * Which balance a spend was drawn from. Free credits are always drawn first.
 */
public enum CreditPool {
    FREE,
    PAID
}
