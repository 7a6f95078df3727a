package uk.gegc.questionbot.features.chat.domain;

import java.util.List;

/**
 * Messages to send back to the chat, in order.
 */
public record ChatReply(List<OutboundMessage> messages) {

    public ChatReply {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ChatReply of(OutboundMessage... messages) {
        return new ChatReply(List.of(messages));
    }

    public static ChatReply text(String text) {
        return of(OutboundMessage.text(text));
    }
}
