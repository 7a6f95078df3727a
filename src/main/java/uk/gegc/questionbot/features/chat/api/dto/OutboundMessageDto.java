package uk.gegc.questionbot.features.chat.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "OutboundMessageDto", description = "One message to send to the chat")
public record OutboundMessageDto(
        @Schema(description = "Message text; absent for a pure document message")
        String text,

        @Schema(description = "Inline buttons under the message")
        List<ReplyButtonDto> buttons,

        @Schema(description = "Attached document, if any")
        ChatDocumentDto document
) {}
