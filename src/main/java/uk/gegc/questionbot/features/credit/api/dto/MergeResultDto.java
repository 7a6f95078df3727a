package uk.gegc.questionbot.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbot.features.credit.domain.model.MergeOutcome;

import java.util.UUID;

@Schema(name = "MergeResultDto", description = "Result of linking a chat identity to a web account")
public record MergeResultDto(
        @Schema(description = "Surviving (web) account")
        UUID accountId,

        @Schema(description = "Email of the surviving account", example = "bob@example.com")
        String email,

        @Schema(description = "What the link did")
        MergeOutcome outcome,

        @Schema(description = "Free credits after the link", example = "1")
        int freeCredits,

        @Schema(description = "Paid credits after the link", example = "5")
        int paidCredits,

        @Schema(description = "Placeholder account absorbed and deleted, if any")
        UUID absorbedAccountId
) {
    public int totalCredits() {
        return freeCredits + paidCredits;
    }
}
