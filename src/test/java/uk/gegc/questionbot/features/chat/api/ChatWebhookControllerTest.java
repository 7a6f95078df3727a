package uk.gegc.questionbot.features.chat.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.questionbot.features.chat.application.ChatUpdateService;
import uk.gegc.questionbot.features.chat.domain.ChatDocument;
import uk.gegc.questionbot.features.chat.domain.ChatReply;
import uk.gegc.questionbot.features.chat.domain.ChatUpdate;
import uk.gegc.questionbot.features.chat.domain.OutboundMessage;
import uk.gegc.questionbot.features.chat.domain.ReplyButton;
import uk.gegc.questionbot.features.chat.infra.mapping.ChatReplyMapperImpl;
import uk.gegc.questionbot.shared.api.advice.GlobalExceptionHandler;
import uk.gegc.questionbot.shared.config.SecurityConfig;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatWebhookController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class, ChatReplyMapperImpl.class})
@ActiveProfiles("test")
@DisplayName("ChatWebhookController")
class ChatWebhookControllerTest {

    private static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    private static final String SECRET = "test-webhook-secret";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ChatUpdateService chatUpdateService;

    @Test
    @DisplayName("text update is handed to the service and its replies are returned in order")
    void textUpdate_returnsReplies() throws Exception {
        ChatReply reply = ChatReply.of(
                OutboundMessage.text("⏳ Generating"),
                OutboundMessage.withButtons("❌ No credits remaining!",
                        List.of(ReplyButton.link("💳 Buy Credits", "https://pay.example.com"))));
        when(chatUpdateService.handle(new ChatUpdate(42L, "asha", "Governor NEET Bill delay", null))).thenReturn(reply);

        mockMvc.perform(post("/api/v1/chat/updates")
                        .header(SECRET_HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":42,\"username\":\"asha\",\"text\":\"Governor NEET Bill delay\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.messages[0].text").value("⏳ Generating"))
                .andExpect(jsonPath("$.messages[1].buttons[0].url").value("https://pay.example.com"));
    }

    @Test
    @DisplayName("document replies carry the file name and content")
    void documentReply_mapped() throws Exception {
        ChatDocument document = new ChatDocument("UPSC_Questions_Topic.txt", "questions", "📄 Download");
        when(chatUpdateService.handle(any(ChatUpdate.class))).thenReturn(ChatReply.of(OutboundMessage.document(document)));

        mockMvc.perform(post("/api/v1/chat/updates")
                        .header(SECRET_HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":42,\"callbackData\":\"check_payment\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].document.fileName").value("UPSC_Questions_Topic.txt"))
                .andExpect(jsonPath("$.messages[0].document.caption").value("📄 Download"));
    }

    @Test
    @DisplayName("missing webhook secret is rejected before the service is called")
    void missingSecret_unauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/chat/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":42,\"text\":\"/start\"}"))
                .andExpect(status().isUnauthorized());

        verify(chatUpdateService, never()).handle(any());
    }

    @Test
    @DisplayName("wrong webhook secret is rejected")
    void wrongSecret_unauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/chat/updates")
                        .header(SECRET_HEADER, "guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":42,\"text\":\"/start\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("update without a chat id fails validation")
    void missingChatId_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chat/updates")
                        .header(SECRET_HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"/start\"}"))
                .andExpect(status().isBadRequest());

        verify(chatUpdateService, never()).handle(any());
    }

    @Test
    @DisplayName("malformed JSON answers 400")
    void malformedJson_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chat/updates")
                        .header(SECRET_HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":"))
                .andExpect(status().isBadRequest());
    }
}
