package uk.gegc.questionbot.features.chat.domain;

public enum QuestionRequestOutcome {
    GENERATED,
    /**
     * The model call failed; the credit is still spent.
     */
    GENERATION_FAILED,
    TOPIC_TOO_SHORT,
    TOPIC_TOO_LONG,
    NO_CREDITS
}
