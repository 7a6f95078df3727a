package uk.gegc.questionbot.features.chat.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "ChatUpdateRequest", description = "Inbound chat event forwarded by the chat platform")
public record ChatUpdateRequest(
        @Schema(description = "Numeric chat identity of the sender", example = "123456789")
        @NotNull
        Long chatId,

        @Schema(description = "Sender's chat username", example = "asha_upsc")
        @Size(max = 255)
        String username,

        @Schema(description = "Message text; absent for button presses", example = "Governor NEET Bill delay")
        @Size(max = 4096)
        String text,

        @Schema(description = "Payload of a pressed inline button", example = "check_payment")
        @Size(max = 64)
        String callbackData
) {}
