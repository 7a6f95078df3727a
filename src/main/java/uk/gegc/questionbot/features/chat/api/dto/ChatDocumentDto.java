package uk.gegc.questionbot.features.chat.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ChatDocumentDto", description = "Text file to attach to the chat")
public record ChatDocumentDto(
        @Schema(description = "File name", example = "UPSC_Questions_Governor_NEET_Bill_delay.txt")
        String fileName,

        @Schema(description = "UTF-8 file content")
        String content,

        @Schema(description = "Caption shown under the file")
        String caption
) {}
