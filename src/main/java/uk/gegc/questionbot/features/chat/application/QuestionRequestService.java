package uk.gegc.questionbot.features.chat.application;

import uk.gegc.questionbot.features.chat.domain.QuestionRequestResult;

public interface QuestionRequestService {

    /**
     * Validates the topic, checks the balance, generates the question set and spends one credit.
     * The credit is spent whether or not generation succeeds; a request that loses the race for the
     * last credit gets {@code NO_CREDITS} and its generated text is dropped.
     */
    QuestionRequestResult request(long chatIdentity, String chatUsername, String topic);
}
