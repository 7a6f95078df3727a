package uk.gegc.questionbot.features.generation.application;

/**
 * Produces a practice question set for a current-affairs topic.
 */
public interface QuestionGenerationService {

    /**
     * Blocks until the model answers; typically tens of seconds.
     *
     * @throws uk.gegc.questionbot.shared.exception.AiServiceException if the model call fails or returns nothing
     */
    String generate(String topic);
}
