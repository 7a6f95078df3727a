package uk.gegc.questionbot.features.chat.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ReplyButtonDto", description = "Inline button: opens a URL or sends callback data back")
public record ReplyButtonDto(
        @Schema(description = "Button label")
        String label,

        @Schema(description = "URL to open")
        String url,

        @Schema(description = "Callback data sent back when pressed")
        String callbackData
) {}
