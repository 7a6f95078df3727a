package uk.gegc.questionbot.features.chat.application;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long texts into chat-sized pieces. Every piece after the first is marked as a continuation.
 */
public final class MessageChunker {

    static final String CONTINUATION_PREFIX = "...continued\n\n";

    private MessageChunker() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static List<String> split(String text, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= chunkSize) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length(); start += chunkSize) {
            String piece = text.substring(start, Math.min(text.length(), start + chunkSize));
            chunks.add(start == 0 ? piece : CONTINUATION_PREFIX + piece);
        }
        return chunks;
    }
}
