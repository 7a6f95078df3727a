package uk.gegc.questionbot.features.chat.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ChatReplyDto", description = "Messages to deliver to the chat, in order")
public record ChatReplyDto(
        @Schema(description = "Ordered messages")
        List<OutboundMessageDto> messages
) {}
