package uk.gegc.questionbot.features.chat.domain;

/**
 * @param questionText     generated set for {@link QuestionRequestOutcome#GENERATED}; the failure text for
 *                         {@link QuestionRequestOutcome#GENERATION_FAILED}
 * @param remainingCredits balance after the spend; {@code null} when nothing was spent
 * @param document         downloadable copy of the set, present only for {@link QuestionRequestOutcome#GENERATED}
 */
public record QuestionRequestResult(QuestionRequestOutcome outcome,
                                    String topic,
                                    String questionText,
                                    Integer remainingCredits,
                                    ChatDocument document) {

    public static QuestionRequestResult rejected(QuestionRequestOutcome outcome, String topic) {
        return new QuestionRequestResult(outcome, topic, null, null, null);
    }
}
