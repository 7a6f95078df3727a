package uk.gegc.questionbot.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "RegisterAccountRequest", description = "Web sign-up hook: records a verified web account")
public record RegisterAccountRequest(
        @Schema(description = "Verified email of the new web account", example = "bob@example.com")
        @NotBlank
        @Email
        @Size(max = 254)
        String email
) {}
