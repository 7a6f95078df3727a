package uk.gegc.questionbot.features.chat.domain;

import java.util.List;

public record OutboundMessage(String text, List<ReplyButton> buttons, ChatDocument document) {

    public OutboundMessage {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, List.of(), null);
    }

    public static OutboundMessage withButtons(String text, List<ReplyButton> buttons) {
        return new OutboundMessage(text, buttons, null);
    }

    public static OutboundMessage document(ChatDocument document) {
        return new OutboundMessage(null, List.of(), document);
    }
}
