package uk.gegc.questionbot.features.linking.domain;

/**
 * Outcome of one linking step. The chat layer turns it into user-facing text.
 *
 * @param state        state after the step
 * @param email        email involved, when relevant
 * @param totalCredits balance after a completed link, or of the already linked account
 */
public record LinkReply(LinkReplyType type, LinkState state, String email, Integer totalCredits) {

    public static LinkReply of(LinkReplyType type, LinkState state) {
        return new LinkReply(type, state, null, null);
    }

    public static LinkReply withEmail(LinkReplyType type, LinkState state, String email) {
        return new LinkReply(type, state, email, null);
    }
}
