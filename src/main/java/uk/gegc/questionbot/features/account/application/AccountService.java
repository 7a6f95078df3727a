package uk.gegc.questionbot.features.account.application;

import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.account.domain.model.Account;

import java.util.Optional;
import java.util.UUID;

public interface AccountService {

    /**
     * Returns the account bound to the chat identity, creating a chat-only placeholder account with the
     * signup grant on first contact. Concurrent first contacts yield a single row.
     */
    Account getOrCreateChatAccount(long chatIdentity, String chatUsername);

    Optional<Account> findByChatIdentity(long chatIdentity);

    Optional<Account> findByEmail(String email);

    /**
     * Records a web sign-up: a registered, verified account with zero credits.
     *
     * @throws uk.gegc.questionbot.features.account.domain.exception.DuplicateAccountException if the email is taken
     */
    BalanceDto registerWebAccount(String email);

    BalanceDto getBalance(UUID accountId);

    BalanceDto getBalanceByEmail(String email);

    /**
     * Chat-only accounts use the reserved placeholder domain; such an address is never a link target.
     */
    boolean isPlaceholderEmail(String email);
}
