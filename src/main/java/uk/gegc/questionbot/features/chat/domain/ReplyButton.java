package uk.gegc.questionbot.features.chat.domain;

/**
 * Inline button under a reply. Exactly one of {@code url} and {@code callbackData} is set.
 */
public record ReplyButton(String label, String url, String callbackData) {

    public static ReplyButton link(String label, String url) {
        return new ReplyButton(label, url, null);
    }

    public static ReplyButton callback(String label, String callbackData) {
        return new ReplyButton(label, null, callbackData);
    }
}
