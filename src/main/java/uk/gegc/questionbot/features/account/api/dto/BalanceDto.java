package uk.gegc.questionbot.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbot.features.account.domain.model.AccountKind;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "BalanceDto", description = "Credit balance of an account")
public record BalanceDto(
        @Schema(description = "Account UUID")
        UUID accountId,

        @Schema(description = "Account email (synthetic for chat-only accounts)", example = "bob@example.com")
        String email,

        @Schema(description = "Bound chat identity, if any", example = "42")
        Long chatIdentity,

        @Schema(description = "Whether the account is a chat-only placeholder or registered")
        AccountKind kind,

        @Schema(description = "Free credits", example = "1")
        int freeCredits,

        @Schema(description = "Paid credits", example = "5")
        int paidCredits,

        @Schema(description = "Free plus paid credits", example = "6")
        int totalCredits,

        @Schema(description = "Number of question sets generated", example = "3")
        long totalQueries,

        @Schema(description = "Time of the last spend (UTC)")
        LocalDateTime lastQueryAt,

        @Schema(description = "Whether a chat identity is linked to a verified email")
        boolean linked
) {}
