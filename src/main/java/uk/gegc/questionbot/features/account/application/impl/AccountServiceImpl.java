package uk.gegc.questionbot.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.account.application.AccountProperties;
import uk.gegc.questionbot.features.account.application.AccountService;
import uk.gegc.questionbot.features.account.domain.exception.DuplicateAccountException;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.account.domain.model.AccountKind;
import uk.gegc.questionbot.features.account.domain.repository.AccountRepository;
import uk.gegc.questionbot.features.account.infra.mapping.AccountMapper;
import uk.gegc.questionbot.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbot.shared.util.EmailAddresses;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.questionbot.shared.util.LogMasking.maskEmail;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;
    private final AccountMapper accountMapper;
    private final AccountProperties accountProperties;
    @Qualifier("utcClock")
    private final Clock utcClock;

    /**
     * Runs outside any caller transaction so a lost insert race does not poison it: the unique
     * constraint on {@code chat_identity} rejects the second insert and the winner is re-read.
     */
    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Account getOrCreateChatAccount(long chatIdentity, String chatUsername) {
        Optional<Account> existing = accountRepository.findByChatIdentity(chatIdentity);
        if (existing.isPresent()) {
            return existing.get();
        }

        Account account = new Account();
        account.setChatIdentity(chatIdentity);
        account.setChatUsername(chatUsername);
        account.setEmail(accountProperties.placeholderEmailFor(chatIdentity));
        account.setKind(AccountKind.CHAT_ONLY);
        account.setEmailVerified(false);
        account.setFreeCredits(accountProperties.getFreeCreditsOnSignup());
        account.setPaidCredits(0);
        account.setTotalQueries(0L);
        account.setCreatedAt(LocalDateTime.now(utcClock));

        try {
            Account saved = accountRepository.saveAndFlush(account);
            log.info("Created chat account {} for chat identity {} with {} free credits",
                    saved.getId(), chatIdentity, saved.getFreeCredits());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent first contact for chat identity {}, re-reading", chatIdentity);
            return accountRepository.findByChatIdentity(chatIdentity)
                    .orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByChatIdentity(long chatIdentity) {
        return accountRepository.findByChatIdentity(chatIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByEmail(String email) {
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return accountRepository.findByEmail(normalized);
    }

    @Override
    @Transactional
    public BalanceDto registerWebAccount(String email) {
        String normalized = EmailAddresses.normalize(email);
        if (!EmailAddresses.isValid(normalized)) {
            throw new IllegalArgumentException("Invalid email address");
        }
        if (isPlaceholderEmail(normalized)) {
            throw new IllegalArgumentException("Email domain is reserved");
        }
        if (accountRepository.existsByEmail(normalized)) {
            throw new DuplicateAccountException("An account with this email already exists");
        }

        Account account = new Account();
        account.setEmail(normalized);
        account.setKind(AccountKind.REGISTERED);
        account.setEmailVerified(true);
        account.setFreeCredits(0);
        account.setPaidCredits(0);
        account.setTotalQueries(0L);
        account.setCreatedAt(LocalDateTime.now(utcClock));

        Account saved = accountRepository.save(account);
        log.info("Registered web account {} for {}", saved.getId(), maskEmail(normalized));
        return accountMapper.toBalanceDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(accountMapper::toBalanceDto)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalanceByEmail(String email) {
        return findByEmail(email)
                .map(accountMapper::toBalanceDto)
                .orElseThrow(() -> new ResourceNotFoundException("No account for email " + maskEmail(email)));
    }

    @Override
    public boolean isPlaceholderEmail(String email) {
        return EmailAddresses.hasDomain(EmailAddresses.normalize(email), accountProperties.getPlaceholderDomain());
    }
}
