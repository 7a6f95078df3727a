package uk.gegc.questionbot.features.credit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.account.domain.model.AccountKind;
import uk.gegc.questionbot.features.account.domain.repository.AccountRepository;
import uk.gegc.questionbot.features.account.infra.mapping.AccountMapper;
import uk.gegc.questionbot.features.credit.api.dto.MergeResultDto;
import uk.gegc.questionbot.features.credit.api.dto.SpendResultDto;
import uk.gegc.questionbot.features.credit.application.CreditMetricsService;
import uk.gegc.questionbot.features.credit.application.CreditService;
import uk.gegc.questionbot.features.credit.domain.exception.AccountLinkConflictException;
import uk.gegc.questionbot.features.credit.domain.exception.InconsistentAccountStateException;
import uk.gegc.questionbot.features.credit.domain.exception.InsufficientCreditsException;
import uk.gegc.questionbot.features.credit.domain.model.CreditPool;
import uk.gegc.questionbot.features.credit.domain.model.CreditTransaction;
import uk.gegc.questionbot.features.credit.domain.model.CreditTransactionType;
import uk.gegc.questionbot.features.credit.domain.model.MergeOutcome;
import uk.gegc.questionbot.features.credit.domain.repository.CreditTransactionRepository;
import uk.gegc.questionbot.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbot.shared.util.EmailAddresses;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditServiceImpl implements CreditService {

    private static final String SPEND_REF = "question-set";
    private static final String MERGE_REF_PREFIX = "link:";

    private final AccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final AccountMapper accountMapper;
    private final CreditMetricsService metricsService;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    @Transactional
    public MergeResultDto merge(long chatIdentity, String chatUsername, String email) {
        String normalized = EmailAddresses.normalize(email);

        // Resolve ids only; the entities are loaded for the first time under their row locks
        UUID webId = accountRepository.findIdByEmail(normalized)
                .orElseThrow(() -> new ResourceNotFoundException("No account for email " + maskEmail(normalized)));
        UUID chatId = accountRepository.findIdByChatIdentity(chatIdentity).orElse(null);

        Account web;
        Account chat;
        if (chatId == null || chatId.equals(webId)) {
            web = lockOrThrow(webId);
            chat = chatId == null ? null : web;
        } else if (webId.compareTo(chatId) < 0) {
            web = lockOrThrow(webId);
            chat = accountRepository.findByIdForUpdate(chatId).orElse(null);
        } else {
            chat = accountRepository.findByIdForUpdate(chatId).orElse(null);
            web = lockOrThrow(webId);
        }

        // Re-validate after locking: a concurrent merge may have moved the chat identity meanwhile
        if (!normalized.equals(web.getEmail())) {
            throw new ResourceNotFoundException("No account for email " + maskEmail(normalized));
        }
        if (chat != null && !Objects.equals(chat.getChatIdentity(), chatIdentity)) {
            chat = null;
        }
        if (chat == null && Objects.equals(web.getChatIdentity(), chatIdentity)) {
            chat = web;
        }

        if (web.getKind() != AccountKind.REGISTERED) {
            throw new InconsistentAccountStateException(
                    "Account " + web.getId() + " owning the link email is not a registered account");
        }
        if (web.getChatIdentity() != null && !web.getChatIdentity().equals(chatIdentity)) {
            log.info("Refusing link of chat identity {}: {} is bound to another chat identity",
                    chatIdentity, maskEmail(normalized));
            throw new AccountLinkConflictException("This email is already linked to another chat account");
        }

        if (chat == null) {
            bind(web, chatIdentity, chatUsername);
            log.info("Bound chat identity {} to account {}", chatIdentity, web.getId());
            metricsService.recordMerge(MergeOutcome.BOUND, 0, 0);
            return toMergeResult(web, MergeOutcome.BOUND, null);
        }

        if (chat.getId().equals(web.getId())) {
            bind(web, chatIdentity, chatUsername);
            log.info("Chat identity {} already linked to account {}", chatIdentity, web.getId());
            metricsService.recordMerge(MergeOutcome.ALREADY_LINKED, 0, 0);
            return toMergeResult(web, MergeOutcome.ALREADY_LINKED, null);
        }

        if (chat.getKind() == AccountKind.REGISTERED) {
            log.error("Chat identity {} is carried by registered account {} while linking to account {}",
                    chatIdentity, chat.getId(), web.getId());
            throw new InconsistentAccountStateException(
                    "Chat identity " + chatIdentity + " belongs to another registered account");
        }

        int movedFree = chat.getFreeCredits();
        int movedPaid = chat.getPaidCredits();
        UUID absorbedId = chat.getId();

        web.setFreeCredits(web.getFreeCredits() + movedFree);
        web.setPaidCredits(web.getPaidCredits() + movedPaid);
        web.setTotalQueries(web.getTotalQueries() + chat.getTotalQueries());
        if (chat.getLastQueryAt() != null
                && (web.getLastQueryAt() == null || chat.getLastQueryAt().isAfter(web.getLastQueryAt()))) {
            web.setLastQueryAt(chat.getLastQueryAt());
        }

        String reference = MERGE_REF_PREFIX + chatIdentity;
        record(absorbedId, CreditTransactionType.MERGE_OUT, -movedFree, -movedPaid, 0, 0, reference);
        record(web.getId(), CreditTransactionType.MERGE_IN, movedFree, movedPaid,
                web.getFreeCredits(), web.getPaidCredits(), reference);

        // The placeholder row must be gone before the unique chat identity moves onto the web account
        accountRepository.delete(chat);
        accountRepository.flush();
        bind(web, chatIdentity, chatUsername);

        log.info("Merged placeholder account {} into {}: moved free={}, paid={}",
                absorbedId, web.getId(), movedFree, movedPaid);
        metricsService.recordMerge(MergeOutcome.MERGED, movedFree, movedPaid);
        return toMergeResult(web, MergeOutcome.MERGED, absorbedId);
    }

    @Override
    @Transactional
    public SpendResultDto spend(UUID accountId) {
        return spendLocked(lockOrThrow(accountId));
    }

    @Override
    @Transactional
    public SpendResultDto spendForChat(long chatIdentity) {
        Optional<Account> account = accountRepository.findByChatIdentityForUpdate(chatIdentity);
        if (account.isEmpty()) {
            // The row may have been absorbed by a merge while we waited for its lock
            account = accountRepository.findByChatIdentityForUpdate(chatIdentity);
        }
        return spendLocked(account.orElseThrow(
                () -> new ResourceNotFoundException("No account for chat identity " + chatIdentity)));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasCreditsForChat(long chatIdentity) {
        return accountRepository.findByChatIdentity(chatIdentity)
                .map(account -> account.getTotalCredits() > 0)
                .orElse(false);
    }

    @Override
    @Transactional
    public BalanceDto creditPaid(UUID accountId, int credits, String reference) {
        if (credits <= 0) {
            throw new IllegalArgumentException("credits must be > 0");
        }
        Account account = lockOrThrow(accountId);
        account.setPaidCredits(account.getPaidCredits() + credits);
        accountRepository.save(account);

        record(account.getId(), CreditTransactionType.TOP_UP, 0, credits,
                account.getFreeCredits(), account.getPaidCredits(), reference);
        log.info("Credited {} paid credits to account {} (ref={})", credits, accountId, reference);
        metricsService.recordTopUp(credits);
        return accountMapper.toBalanceDto(account);
    }

    private SpendResultDto spendLocked(Account account) {
        if (account.getTotalCredits() <= 0) {
            metricsService.recordInsufficientCredits();
            throw new InsufficientCreditsException(account.getId());
        }

        CreditPool pool;
        int freeDelta = 0;
        int paidDelta = 0;
        if (account.getFreeCredits() > 0) {
            account.setFreeCredits(account.getFreeCredits() - 1);
            pool = CreditPool.FREE;
            freeDelta = -1;
        } else {
            account.setPaidCredits(account.getPaidCredits() - 1);
            pool = CreditPool.PAID;
            paidDelta = -1;
        }
        account.setTotalQueries(account.getTotalQueries() + 1);
        account.setLastQueryAt(LocalDateTime.now(utcClock));
        accountRepository.save(account);

        record(account.getId(), CreditTransactionType.SPEND, freeDelta, paidDelta,
                account.getFreeCredits(), account.getPaidCredits(), SPEND_REF);
        log.debug("Spent one {} credit from account {}; {} left", pool, account.getId(), account.getTotalCredits());
        metricsService.recordSpend(pool);

        return new SpendResultDto(account.getId(), pool, account.getFreeCredits(), account.getPaidCredits(),
                account.getTotalQueries());
    }

    private Account lockOrThrow(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }

    private void bind(Account web, long chatIdentity, String chatUsername) {
        web.setChatIdentity(chatIdentity);
        if (chatUsername != null) {
            web.setChatUsername(chatUsername);
        }
        web.setEmailVerified(true);
        web.setKind(AccountKind.REGISTERED);
        accountRepository.save(web);
    }

    private void record(UUID accountId, CreditTransactionType type, int freeDelta, int paidDelta,
                        int balanceAfterFree, int balanceAfterPaid, String reference) {
        CreditTransaction tx = new CreditTransaction();
        tx.setAccountId(accountId);
        tx.setType(type);
        tx.setFreeDelta(freeDelta);
        tx.setPaidDelta(paidDelta);
        tx.setBalanceAfterFree(balanceAfterFree);
        tx.setBalanceAfterPaid(balanceAfterPaid);
        tx.setReference(reference);
        tx.setCreatedAt(LocalDateTime.now(utcClock));
        transactionRepository.save(tx);
    }

    private MergeResultDto toMergeResult(Account web, MergeOutcome outcome, UUID absorbedId) {
        return new MergeResultDto(web.getId(), web.getEmail(), outcome,
                web.getFreeCredits(), web.getPaidCredits(), absorbedId);
    }
}
