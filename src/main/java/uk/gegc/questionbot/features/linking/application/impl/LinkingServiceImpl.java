package uk.gegc.questionbot.features.linking.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbot.features.account.application.AccountService;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.credit.api.dto.MergeResultDto;
import uk.gegc.questionbot.features.credit.application.CreditService;
import uk.gegc.questionbot.features.credit.domain.exception.AccountLinkConflictException;
import uk.gegc.questionbot.features.credit.domain.exception.InconsistentAccountStateException;
import uk.gegc.questionbot.features.linking.application.LinkingService;
import uk.gegc.questionbot.features.linking.domain.LinkReply;
import uk.gegc.questionbot.features.linking.domain.LinkReplyType;
import uk.gegc.questionbot.features.linking.domain.LinkSession;
import uk.gegc.questionbot.features.linking.domain.LinkSessionStore;
import uk.gegc.questionbot.features.linking.domain.LinkState;
import uk.gegc.questionbot.features.otp.application.OtpService;
import uk.gegc.questionbot.features.otp.domain.exception.PasscodeDeliveryException;
import uk.gegc.questionbot.shared.util.EmailAddresses;

import java.util.Optional;
import java.util.regex.Pattern;

import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

@Slf4j
@Service
@RequiredArgsConstructor
public class LinkingServiceImpl implements LinkingService {

    private static final Pattern PASSCODE = Pattern.compile("[0-9]{6}");

    private final LinkSessionStore sessionStore;
    private final AccountService accountService;
    private final OtpService otpService;
    private final CreditService creditService;

    @Override
    public LinkReply begin(long chatIdentity) {
        Optional<Account> current = accountService.findByChatIdentity(chatIdentity);
        if (current.isPresent() && current.get().isLinked()) {
            sessionStore.remove(chatIdentity);
            Account account = current.get();
            return new LinkReply(LinkReplyType.ALREADY_LINKED, LinkState.IDLE,
                    account.getEmail(), account.getTotalCredits());
        }
        sessionStore.save(chatIdentity, LinkSession.awaitingEmail());
        log.debug("Chat identity {} started linking", chatIdentity);
        return LinkReply.of(LinkReplyType.PROMPT_EMAIL, LinkState.AWAITING_EMAIL);
    }

    @Override
    public LinkReply handleText(long chatIdentity, String chatUsername, String text) {
        Optional<LinkSession> session = sessionStore.find(chatIdentity);
        if (session.isEmpty()) {
            return LinkReply.of(LinkReplyType.NO_ACTIVE_SESSION, LinkState.IDLE);
        }
        return switch (session.get().state()) {
            case AWAITING_EMAIL -> handleEmail(chatIdentity, session.get(), text);
            case AWAITING_CODE -> handleCode(chatIdentity, chatUsername, session.get().candidateEmail(), text);
            default -> {
                sessionStore.remove(chatIdentity);
                yield LinkReply.of(LinkReplyType.NO_ACTIVE_SESSION, LinkState.IDLE);
            }
        };
    }

    @Override
    public LinkReply cancel(long chatIdentity) {
        if (sessionStore.remove(chatIdentity).isPresent()) {
            log.debug("Chat identity {} cancelled linking", chatIdentity);
            return LinkReply.of(LinkReplyType.CANCELLED, LinkState.CANCELLED);
        }
        return LinkReply.of(LinkReplyType.NOTHING_TO_CANCEL, LinkState.IDLE);
    }

    @Override
    public boolean hasActiveSession(long chatIdentity) {
        return sessionStore.find(chatIdentity).isPresent();
    }

    private LinkReply handleEmail(long chatIdentity, LinkSession current, String text) {
        String email = EmailAddresses.normalize(text);
        if (!EmailAddresses.isValid(email) || accountService.isPlaceholderEmail(email)) {
            return LinkReply.of(LinkReplyType.INVALID_EMAIL, LinkState.AWAITING_EMAIL);
        }

        Optional<Account> target = accountService.findByEmail(email);
        if (target.isEmpty()) {
            return LinkReply.withEmail(LinkReplyType.ACCOUNT_NOT_FOUND, LinkState.AWAITING_EMAIL, email);
        }
        Long boundIdentity = target.get().getChatIdentity();
        if (boundIdentity != null && boundIdentity != chatIdentity) {
            sessionStore.remove(chatIdentity);
            log.info("Chat identity {} tried to link {} which is bound elsewhere", chatIdentity, maskEmail(email));
            return LinkReply.withEmail(LinkReplyType.EMAIL_BOUND_ELSEWHERE, LinkState.CANCELLED, email);
        }

        try {
            otpService.issueAndSend(email);
        } catch (PasscodeDeliveryException e) {
            return LinkReply.withEmail(LinkReplyType.DELIVERY_FAILED, LinkState.AWAITING_EMAIL, email);
        }

        // A /cancel or expiry while the code was being sent wins; the issued code simply expires
        if (!sessionStore.replace(chatIdentity, current, LinkSession.awaitingCode(email))) {
            log.info("Link session of chat identity {} ended while a code was sent to {}", chatIdentity, maskEmail(email));
            return LinkReply.of(LinkReplyType.CANCELLED, LinkState.CANCELLED);
        }
        return LinkReply.withEmail(LinkReplyType.CODE_SENT, LinkState.AWAITING_CODE, email);
    }

    private LinkReply handleCode(long chatIdentity, String chatUsername, String email, String text) {
        String code = text == null ? "" : text.trim();
        if (!PASSCODE.matcher(code).matches()) {
            return LinkReply.withEmail(LinkReplyType.INVALID_CODE, LinkState.AWAITING_CODE, email);
        }

        // Every path from here ends the session; only the caller that removes it may redeem the code
        if (sessionStore.remove(chatIdentity).isEmpty()) {
            return LinkReply.of(LinkReplyType.CANCELLED, LinkState.CANCELLED);
        }

        boolean verified;
        try {
            verified = otpService.verify(email, code);
        } catch (RuntimeException e) {
            log.error("Passcode verification failed for chat identity {}", chatIdentity, e);
            return LinkReply.withEmail(LinkReplyType.LINK_FAILED, LinkState.CANCELLED, email);
        }
        if (!verified) {
            return LinkReply.withEmail(LinkReplyType.VERIFICATION_FAILED, LinkState.CANCELLED, email);
        }

        try {
            MergeResultDto result = creditService.merge(chatIdentity, chatUsername, email);
            log.info("Chat identity {} linked to account {} ({})", chatIdentity, result.accountId(), result.outcome());
            return new LinkReply(LinkReplyType.LINKED, LinkState.LINKED, result.email(), result.totalCredits());
        } catch (AccountLinkConflictException e) {
            return LinkReply.withEmail(LinkReplyType.EMAIL_BOUND_ELSEWHERE, LinkState.CANCELLED, email);
        } catch (InconsistentAccountStateException e) {
            log.error("Inconsistent account state while linking chat identity {} to {}: {}",
                    chatIdentity, maskEmail(email), e.getMessage());
            return LinkReply.withEmail(LinkReplyType.INCONSISTENT_STATE, LinkState.CANCELLED, email);
        } catch (RuntimeException e) {
            log.error("Linking chat identity {} to {} failed", chatIdentity, maskEmail(email), e);
            return LinkReply.withEmail(LinkReplyType.LINK_FAILED, LinkState.CANCELLED, email);
        }
    }
}
