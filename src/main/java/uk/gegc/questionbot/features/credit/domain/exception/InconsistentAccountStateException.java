package uk.gegc.questionbot.features.credit.domain.exception;

/**
 * The chat identity already belongs to a registered account other than the one being linked.
 * Nothing is written when this is raised; it needs operator attention.
 */
public class InconsistentAccountStateException extends RuntimeException {

    public InconsistentAccountStateException(String message) {
        super(message);
    }
}
