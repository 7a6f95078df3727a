package uk.gegc.questionbot.features.linking.domain;

/**
 * Per-chat progress through account linking. {@link #LINKED} and {@link #CANCELLED} are terminal:
 * the session is dropped and the next link attempt starts from {@link #IDLE}.
 */
public enum LinkState {
    IDLE,
    AWAITING_EMAIL,
    AWAITING_CODE,
    LINKED,
    CANCELLED;

    public boolean isTerminal() {
        return this == LINKED || this == CANCELLED;
    }
}
