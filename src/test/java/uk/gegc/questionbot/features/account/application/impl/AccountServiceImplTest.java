package uk.gegc.questionbot.features.account.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.questionbot.features.account.application.AccountProperties;
import uk.gegc.questionbot.features.account.domain.exception.DuplicateAccountException;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.account.domain.model.AccountKind;
import uk.gegc.questionbot.features.account.domain.repository.AccountRepository;
import uk.gegc.questionbot.features.account.infra.mapping.AccountMapper;
import uk.gegc.questionbot.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static uk.gegc.questionbot.testsupport.AccountFixtures.placeholder;
import static uk.gegc.questionbot.testsupport.AccountFixtures.withId;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccountServiceImpl")
class AccountServiceImplTest {

    @Mock
    private AccountRepository accountRepository;
    @Mock
    private AccountMapper accountMapper;

    private AccountServiceImpl accountService;

    @BeforeEach
    void setUp() {
        accountService = new AccountServiceImpl(accountRepository, accountMapper, new AccountProperties(),
                Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("getOrCreateChatAccount")
    class GetOrCreate {

        @Test
        @DisplayName("returns the existing account without writing")
        void existing_returned() {
            Account existing = withId(placeholder(5L, 0, 2));
            when(accountRepository.findByChatIdentity(5L)).thenReturn(Optional.of(existing));

            assertThat(accountService.getOrCreateChatAccount(5L, "u")).isSameAs(existing);
            verify(accountRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("first contact creates a chat-only account with the signup grant and a placeholder email")
        void firstContact_creates() {
            when(accountRepository.findByChatIdentity(5L)).thenReturn(Optional.empty());
            when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

            Account created = accountService.getOrCreateChatAccount(5L, "asha");

            assertThat(created.getKind()).isEqualTo(AccountKind.CHAT_ONLY);
            assertThat(created.getEmail()).isEqualTo("tg_5@telegram.placeholder");
            assertThat(created.isEmailVerified()).isFalse();
            assertThat(created.getFreeCredits()).isEqualTo(1);
            assertThat(created.getPaidCredits()).isZero();
            assertThat(created.getChatUsername()).isEqualTo("asha");
            assertThat(created.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
        }

        @Test
        @DisplayName("losing a concurrent first-contact insert returns the winner's row")
        void concurrentFirstContact_returnsWinner() {
            Account winner = withId(placeholder(5L, 1, 0));
            when(accountRepository.findByChatIdentity(5L)).thenReturn(Optional.empty(), Optional.of(winner));
            when(accountRepository.saveAndFlush(any(Account.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_accounts_chat_identity"));

            assertThat(accountService.getOrCreateChatAccount(5L, "asha")).isSameAs(winner);
        }
    }

    @Nested
    @DisplayName("registerWebAccount")
    class Register {

        @Test
        @DisplayName("creates a registered verified account with zero credits")
        void register_creates() {
            when(accountRepository.existsByEmail("new@example.com")).thenReturn(false);
            when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

            accountService.registerWebAccount(" New@Example.com ");

            ArgumentCaptor<Account> captor = ArgumentCaptor.forClass(Account.class);
            verify(accountRepository).save(captor.capture());
            Account saved = captor.getValue();
            assertThat(saved.getEmail()).isEqualTo("new@example.com");
            assertThat(saved.getKind()).isEqualTo(AccountKind.REGISTERED);
            assertThat(saved.isEmailVerified()).isTrue();
            assertThat(saved.getTotalCredits()).isZero();
            assertThat(saved.getChatIdentity()).isNull();
        }

        @Test
        @DisplayName("duplicate email is rejected")
        void register_duplicate() {
            when(accountRepository.existsByEmail("dup@example.com")).thenReturn(true);

            assertThatThrownBy(() -> accountService.registerWebAccount("dup@example.com"))
                    .isInstanceOf(DuplicateAccountException.class);
        }

        @Test
        @DisplayName("reserved placeholder domain is rejected")
        void register_placeholderDomain() {
            assertThatThrownBy(() -> accountService.registerWebAccount("tg_1@telegram.placeholder"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("malformed email is rejected")
        void register_invalid() {
            assertThatThrownBy(() -> accountService.registerWebAccount("nope"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("balance lookup by unknown email is not found")
    void getBalanceByEmail_unknown() {
        when(accountRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.getBalanceByEmail("ghost@example.com"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("placeholder detection uses the configured domain")
    void isPlaceholderEmail() {
        assertThat(accountService.isPlaceholderEmail("TG_9@Telegram.Placeholder")).isTrue();
        assertThat(accountService.isPlaceholderEmail("bob@example.com")).isFalse();
    }
}
