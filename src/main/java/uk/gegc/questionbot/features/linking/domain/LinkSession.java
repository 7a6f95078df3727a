package uk.gegc.questionbot.features.linking.domain;

/**
 * @param state          current state, never terminal while stored
 * @param candidateEmail normalised email awaiting passcode proof; set only in {@link LinkState#AWAITING_CODE}
 */
public record LinkSession(LinkState state, String candidateEmail) {

    public static LinkSession awaitingEmail() {
        return new LinkSession(LinkState.AWAITING_EMAIL, null);
    }

    public static LinkSession awaitingCode(String email) {
        return new LinkSession(LinkState.AWAITING_CODE, email);
    }
}
