package uk.gegc.questionbot.features.chat.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbot.features.account.application.AccountService;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.chat.application.ChatBotProperties;
import uk.gegc.questionbot.features.chat.application.ChatMessages;
import uk.gegc.questionbot.features.chat.application.ChatUpdateService;
import uk.gegc.questionbot.features.chat.application.MessageChunker;
import uk.gegc.questionbot.features.chat.application.QuestionRequestService;
import uk.gegc.questionbot.features.chat.domain.ChatReply;
import uk.gegc.questionbot.features.chat.domain.ChatUpdate;
import uk.gegc.questionbot.features.chat.domain.OutboundMessage;
import uk.gegc.questionbot.features.chat.domain.QuestionRequestResult;
import uk.gegc.questionbot.features.linking.application.LinkingService;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatUpdateServiceImpl implements ChatUpdateService {

    private final AccountService accountService;
    private final LinkingService linkingService;
    private final QuestionRequestService questionRequestService;
    private final ChatMessages messages;
    private final ChatBotProperties properties;

    @Override
    public ChatReply handle(ChatUpdate update) {
        try {
            if (update.isCallback()) {
                return handleCallback(update);
            }
            String text = update.text() == null ? "" : update.text().trim();
            if (text.isEmpty()) {
                return ChatReply.text(messages.emptyMessage());
            }
            if (text.startsWith("/")) {
                return handleCommand(update, commandName(text));
            }
            if (linkingService.hasActiveSession(update.chatIdentity())) {
                return ChatReply.text(messages.link(
                        linkingService.handleText(update.chatIdentity(), update.username(), text)));
            }
            return toReply(questionRequestService.request(update.chatIdentity(), update.username(), text));
        } catch (Exception e) {
            log.error("Failed to handle chat update for chat identity {}", update.chatIdentity(), e);
            return ChatReply.text(messages.unexpectedError());
        }
    }

    /**
     * {@code "/Credits@SomeBot now"} becomes {@code "credits"}.
     */
    static String commandName(String text) {
        String token = text.split("\\s+", 2)[0].substring(1);
        int at = token.indexOf('@');
        if (at >= 0) {
            token = token.substring(0, at);
        }
        return token.toLowerCase(Locale.ROOT);
    }

    private ChatReply handleCommand(ChatUpdate update, String command) {
        long chatIdentity = update.chatIdentity();
        return switch (command) {
            case "start" -> ChatReply.text(messages.welcome(
                    accountService.getOrCreateChatAccount(chatIdentity, update.username())));
            case "help" -> ChatReply.text(messages.help());
            case "credits" -> accountService.findByChatIdentity(chatIdentity)
                    .map(account -> ChatReply.text(messages.credits(account)))
                    .orElseGet(() -> ChatReply.text(messages.userNotFound()));
            case "buy" -> buy(chatIdentity);
            case "paid" -> paid(chatIdentity);
            case "link" -> ChatReply.text(messages.link(linkingService.begin(chatIdentity)));
            case "cancel" -> ChatReply.text(messages.link(linkingService.cancel(chatIdentity)));
            default -> ChatReply.text(messages.unknownCommand());
        };
    }

    private ChatReply handleCallback(ChatUpdate update) {
        return switch (update.callbackData()) {
            case ChatMessages.CALLBACK_CHECK_PAYMENT -> paid(update.chatIdentity());
            case ChatMessages.CALLBACK_START_LINK -> ChatReply.text(messages.startLinkHint());
            default -> {
                log.warn("Unknown callback data from chat identity {}: {}", update.chatIdentity(), update.callbackData());
                yield ChatReply.text(messages.unknownCommand());
            }
        };
    }

    private ChatReply buy(long chatIdentity) {
        Optional<Account> account = accountService.findByChatIdentity(chatIdentity);
        if (account.isPresent() && account.get().isLinked()) {
            return ChatReply.of(OutboundMessage.withButtons(
                    messages.buyLinked(account.get()), messages.buyLinkedButtons()));
        }
        return ChatReply.of(OutboundMessage.withButtons(messages.buyUnlinked(), messages.buyUnlinkedButtons()));
    }

    // Payment capture happens on the web side; this only re-reads the authoritative balance
    private ChatReply paid(long chatIdentity) {
        Optional<Account> account = accountService.findByChatIdentity(chatIdentity);
        if (account.isEmpty()) {
            return ChatReply.text(messages.userNotFound());
        }
        if (!account.get().isLinked()) {
            return ChatReply.text(messages.paidNotLinked());
        }
        return ChatReply.text(messages.paidBalance(account.get()));
    }

    private ChatReply toReply(QuestionRequestResult result) {
        return switch (result.outcome()) {
            case TOPIC_TOO_SHORT -> ChatReply.text(messages.topicTooShort());
            case TOPIC_TOO_LONG -> ChatReply.text(messages.topicTooLong());
            case NO_CREDITS -> ChatReply.of(OutboundMessage.withButtons(
                    messages.noCredits(), messages.noCreditsButtons()));
            case GENERATION_FAILED -> ChatReply.of(
                    OutboundMessage.text(messages.generationFailed(result.questionText())),
                    OutboundMessage.text(messages.creditsRemaining(result.remainingCredits())));
            case GENERATED -> {
                List<OutboundMessage> out = new ArrayList<>();
                MessageChunker.split(result.questionText(), properties.getMessageChunkSize())
                        .forEach(chunk -> out.add(OutboundMessage.text(chunk)));
                out.add(OutboundMessage.document(result.document()));
                out.add(OutboundMessage.text(messages.creditsRemaining(result.remainingCredits())));
                yield new ChatReply(out);
            }
        };
    }
}
