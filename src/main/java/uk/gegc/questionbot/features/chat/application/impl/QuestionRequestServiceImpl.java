package uk.gegc.questionbot.features.chat.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbot.features.account.application.AccountService;
import uk.gegc.questionbot.features.chat.application.ChatBotProperties;
import uk.gegc.questionbot.features.chat.application.QuestionDocumentFactory;
import uk.gegc.questionbot.features.chat.application.QuestionRequestService;
import uk.gegc.questionbot.features.chat.domain.QuestionRequestOutcome;
import uk.gegc.questionbot.features.chat.domain.QuestionRequestResult;
import uk.gegc.questionbot.features.credit.api.dto.SpendResultDto;
import uk.gegc.questionbot.features.credit.application.CreditService;
import uk.gegc.questionbot.features.credit.domain.exception.InsufficientCreditsException;
import uk.gegc.questionbot.features.generation.application.QuestionGenerationService;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionRequestServiceImpl implements QuestionRequestService {

    private final AccountService accountService;
    private final CreditService creditService;
    private final QuestionGenerationService generationService;
    private final QuestionDocumentFactory documentFactory;
    private final ChatBotProperties properties;

    @Override
    public QuestionRequestResult request(long chatIdentity, String chatUsername, String topic) {
        String trimmed = topic == null ? "" : topic.trim();
        if (trimmed.length() < properties.getMinTopicLength()) {
            return QuestionRequestResult.rejected(QuestionRequestOutcome.TOPIC_TOO_SHORT, trimmed);
        }
        if (trimmed.length() > properties.getMaxTopicLength()) {
            return QuestionRequestResult.rejected(QuestionRequestOutcome.TOPIC_TOO_LONG, trimmed);
        }

        accountService.getOrCreateChatAccount(chatIdentity, chatUsername);
        // By chat identity: a merge may absorb the placeholder between creation and this check
        if (!creditService.hasCreditsForChat(chatIdentity)) {
            log.info("Chat identity {} has no credits; request rejected", chatIdentity);
            return QuestionRequestResult.rejected(QuestionRequestOutcome.NO_CREDITS, trimmed);
        }

        String questions = null;
        String failure = null;
        try {
            questions = generationService.generate(trimmed);
        } catch (RuntimeException e) {
            log.warn("Generation failed for chat identity {}: {}", chatIdentity, e.getMessage());
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        SpendResultDto spend;
        try {
            spend = creditService.spendForChat(chatIdentity);
        } catch (InsufficientCreditsException e) {
            log.info("Chat identity {} lost the race for its last credit; dropping generated set", chatIdentity);
            return QuestionRequestResult.rejected(QuestionRequestOutcome.NO_CREDITS, trimmed);
        }

        if (questions == null) {
            return new QuestionRequestResult(QuestionRequestOutcome.GENERATION_FAILED, trimmed, failure,
                    spend.totalCredits(), null);
        }
        return new QuestionRequestResult(QuestionRequestOutcome.GENERATED, trimmed, questions,
                spend.totalCredits(), documentFactory.create(trimmed, questions));
    }
}
