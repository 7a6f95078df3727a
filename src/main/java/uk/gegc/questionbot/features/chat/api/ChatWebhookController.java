package uk.gegc.questionbot.features.chat.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionbot.features.chat.api.dto.ChatReplyDto;
import uk.gegc.questionbot.features.chat.api.dto.ChatUpdateRequest;
import uk.gegc.questionbot.features.chat.application.ChatUpdateService;
import uk.gegc.questionbot.features.chat.domain.ChatUpdate;
import uk.gegc.questionbot.features.chat.infra.mapping.ChatReplyMapper;

@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Tag(name = "Chat", description = "Webhook for the chat platform")
public class ChatWebhookController {

    private final ChatUpdateService chatUpdateService;
    private final ChatReplyMapper chatReplyMapper;

    @Operation(
            summary = "Handle a chat update",
            description = "Processes one chat message or button press and returns the replies to deliver. "
                    + "Requires the X-Telegram-Bot-Api-Secret-Token header."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Replies to deliver",
                    content = @Content(schema = @Schema(implementation = ChatReplyDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Malformed update"),
            @ApiResponse(responseCode = "401", description = "Missing or wrong webhook secret")
    })
    @PostMapping("/updates")
    public ResponseEntity<ChatReplyDto> handleUpdate(@Valid @RequestBody ChatUpdateRequest request) {
        ChatUpdate update = new ChatUpdate(request.chatId(), request.username(), request.text(), request.callbackData());
        return ResponseEntity.ok(chatReplyMapper.toDto(chatUpdateService.handle(update)));
    }
}
