package uk.gegc.questionbot.features.account.domain.model;

public enum AccountKind {
    /**
     * Created lazily from a chat identity; carries a synthetic placeholder email.
     */
    CHAT_ONLY,
    /**
     * Owns a real, verified email address (web sign-up or a completed link).
     */
    REGISTERED
}
