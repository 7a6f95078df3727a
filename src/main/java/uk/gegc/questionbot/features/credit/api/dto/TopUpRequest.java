package uk.gegc.questionbot.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "TopUpRequest", description = "Paid credits confirmed by the payment side")
public record TopUpRequest(
        @Schema(description = "Credits to add", example = "10")
        @Positive
        @Max(10_000)
        int credits,

        @Schema(description = "Payment reference for the audit trail", example = "pay_29QQoUBi66xm2f")
        @Size(max = 255)
        String reference
) {}
