package uk.gegc.questionbot.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbot.features.credit.domain.model.CreditPool;

import java.util.UUID;

@Schema(name = "SpendResultDto", description = "Balance after one credit was spent")
public record SpendResultDto(
        @Schema(description = "Account charged")
        UUID accountId,

        @Schema(description = "Pool the credit was taken from")
        CreditPool spentFrom,

        @Schema(description = "Free credits left", example = "0")
        int freeCredits,

        @Schema(description = "Paid credits left", example = "4")
        int paidCredits,

        @Schema(description = "Question sets generated so far", example = "7")
        long totalQueries
) {
    public int totalCredits() {
        return freeCredits + paidCredits;
    }
}
