package uk.gegc.questionbot.features.chat.application;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.questionbot.features.chat.domain.ChatDocument;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builds the downloadable text copy of a generated question set.
 */
@Component
public class QuestionDocumentFactory {

    private static final int TOPIC_PREFIX_LENGTH = 30;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");
    private static final String CAPTION = "📄 Download questions as text file";

    private final Clock utcClock;

    public QuestionDocumentFactory(@Qualifier("utcClock") Clock utcClock) {
        this.utcClock = utcClock;
    }

    public ChatDocument create(String topic, String questions) {
        StringBuilder content = new StringBuilder();
        content.append("UPSC Predictor - Generated Questions\n");
        content.append("Topic: ").append(topic).append('\n');
        content.append("Generated: ").append(LocalDateTime.now(utcClock).format(TIMESTAMP)).append('\n');
        content.append("=".repeat(50)).append("\n\n");
        content.append(questions);
        return new ChatDocument(fileName(topic), content.toString(), CAPTION);
    }

    static String fileName(String topic) {
        String prefix = topic.length() > TOPIC_PREFIX_LENGTH ? topic.substring(0, TOPIC_PREFIX_LENGTH) : topic;
        return "UPSC_Questions_" + prefix.replace(' ', '_') + ".txt";
    }
}
