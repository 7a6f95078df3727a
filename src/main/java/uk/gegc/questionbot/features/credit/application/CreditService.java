package uk.gegc.questionbot.features.credit.application;

import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.credit.api.dto.MergeResultDto;
import uk.gegc.questionbot.features.credit.api.dto.SpendResultDto;

import java.util.UUID;

/**
 * Every balance mutation goes through this service. Each operation is one transaction that
 * row-locks the accounts it touches, so credits are never created, lost or overdrawn.
 */
public interface CreditService {

    /**
     * Links a chat identity to the web account owning {@code email}, absorbing any placeholder account
     * that currently carries the chat identity. The email must already have been proven by passcode.
     *
     * @throws uk.gegc.questionbot.shared.exception.ResourceNotFoundException          no account owns the email
     * @throws uk.gegc.questionbot.features.credit.domain.exception.AccountLinkConflictException
     *                                                                                   the web account is bound to another chat identity
     * @throws uk.gegc.questionbot.features.credit.domain.exception.InconsistentAccountStateException
     *                                                                                   the chat identity sits on another registered account
     */
    MergeResultDto merge(long chatIdentity, String chatUsername, String email);

    /**
     * Spends one credit, free before paid.
     *
     * @throws uk.gegc.questionbot.features.credit.domain.exception.InsufficientCreditsException if the balance is zero
     */
    SpendResultDto spend(UUID accountId);

    /**
     * Spends one credit from whichever account carries the chat identity at the time the lock is taken.
     */
    SpendResultDto spendForChat(long chatIdentity);

    /**
     * Whether the account carrying the chat identity right now has any credit left.
     */
    boolean hasCreditsForChat(long chatIdentity);

    /**
     * Adds paid credits confirmed out of band by the payment side.
     */
    BalanceDto creditPaid(UUID accountId, int credits, String reference);
}
