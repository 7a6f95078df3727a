package uk.gegc.questionbot.features.chat.domain;

/**
 * One inbound chat event: either a text message or a button press.
 *
 * @param callbackData payload of the pressed inline button; {@code null} for text messages
 */
public record ChatUpdate(long chatIdentity, String username, String text, String callbackData) {

    public boolean isCallback() {
        return callbackData != null && !callbackData.isBlank();
    }
}
