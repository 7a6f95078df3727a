package uk.gegc.questionbot.features.credit.domain.exception;

/**
 * The target account is already bound to a different chat identity.
 */
public class AccountLinkConflictException extends RuntimeException {

    public AccountLinkConflictException(String message) {
        super(message);
    }
}
