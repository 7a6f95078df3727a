package uk.gegc.questionbot.features.chat.application;

import uk.gegc.questionbot.features.chat.domain.ChatReply;
import uk.gegc.questionbot.features.chat.domain.ChatUpdate;

/**
 * Entry point of the chat surface. Never throws: every failure becomes a reply.
 */
public interface ChatUpdateService {

    ChatReply handle(ChatUpdate update);
}
