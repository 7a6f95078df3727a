package uk.gegc.questionbot.features.linking.application;

import uk.gegc.questionbot.features.linking.domain.LinkReply;

/**
 * Conversation that links a chat identity to an existing web account: ask for the email, send a
 * passcode to it, check the passcode, then merge the accounts.
 */
public interface LinkingService {

    LinkReply begin(long chatIdentity);

    /**
     * Feeds a free-text message to the open session of this chat identity.
     */
    LinkReply handleText(long chatIdentity, String chatUsername, String text);

    LinkReply cancel(long chatIdentity);

    boolean hasActiveSession(long chatIdentity);
}
