package uk.gegc.questionbot.features.chat.integration;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.ResultActions;
import uk.gegc.questionbot.BaseIntegrationTest;
import uk.gegc.questionbot.features.generation.application.QuestionGenerationService;
import uk.gegc.questionbot.shared.email.EmailService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the webhook and the account hooks end to end: a chat user with a free credit links to a web
 * account holding paid credits, and the merged balance serves the next question set.
 */
@DisplayName("Chat link flow")
class ChatLinkFlowIntegrationTest extends BaseIntegrationTest {

    private static final String CHAT_SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    private static final String CHAT_SECRET = "test-webhook-secret";
    private static final String API_KEY_HEADER = "X-Api-Key";
    private static final String API_KEY = "test-api-key";

    @MockitoBean
    private EmailService emailService;

    @MockitoBean
    private QuestionGenerationService questionGenerationService;

    private ResultActions chat(long chatId, String text) throws Exception {
        return mockMvc.perform(post("/api/v1/chat/updates")
                .header(CHAT_SECRET_HEADER, CHAT_SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":" + chatId + ",\"username\":\"bob\",\"text\":\"" + text + "\"}"));
    }

    @Test
    @DisplayName("linking merges the chat credit into the web account and spends from the merged balance")
    void linkThenGenerate() throws Exception {
        mockMvc.perform(post("/api/v1/accounts")
                        .header(API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"bob@example.com\"}"))
                .andExpect(status().isCreated());
        String balanceJson = mockMvc.perform(get("/api/v1/accounts/balance")
                        .param("email", "bob@example.com")
                        .header(API_KEY_HEADER, API_KEY))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String webId = JsonPath.read(balanceJson, "$.accountId");

        mockMvc.perform(post("/api/v1/accounts/{id}/credits", webId)
                        .header(API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"credits\":4,\"reference\":\"pay_1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paidCredits").value(4));

        chat(1004L, "/start")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].text", containsString("You have 1 credit(s)")));

        chat(1004L, "/link")
                .andExpect(jsonPath("$.messages[0].text", containsString("Enter the email")));

        when(emailService.sendLinkPasscodeEmail(eq("bob@example.com"), anyString())).thenReturn(true);
        chat(1004L, "Bob@Example.com")
                .andExpect(jsonPath("$.messages[0].text", containsString("Code sent to bob@example.com")));

        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(emailService).sendLinkPasscodeEmail(eq("bob@example.com"), code.capture());

        chat(1004L, code.getValue())
                .andExpect(jsonPath("$.messages[0].text", containsString("Successfully linked")))
                .andExpect(jsonPath("$.messages[0].text", containsString("Credits: 5")));

        when(questionGenerationService.generate("Governor NEET Bill delay")).thenReturn("Q1. Consider the following");
        chat(1004L, "Governor NEET Bill delay")
                .andExpect(jsonPath("$.messages[0].text").value("Q1. Consider the following"))
                .andExpect(jsonPath("$.messages[1].document.fileName",
                        containsString("UPSC_Questions_Governor_NEET_Bill_delay")))
                .andExpect(jsonPath("$.messages[2].text", containsString("Credits remaining: 4")));

        mockMvc.perform(get("/api/v1/accounts/balance")
                        .param("email", "bob@example.com")
                        .header(API_KEY_HEADER, API_KEY))
                .andExpect(jsonPath("$.accountId").value(webId))
                .andExpect(jsonPath("$.chatIdentity").value(1004))
                .andExpect(jsonPath("$.freeCredits").value(0))
                .andExpect(jsonPath("$.paidCredits").value(4))
                .andExpect(jsonPath("$.linked").value(true));
    }

    @Test
    @DisplayName("an unknown email keeps the session open and sends no code")
    void unknownEmail_noCode() throws Exception {
        chat(2001L, "/start").andExpect(status().isOk());
        chat(2001L, "/link");

        chat(2001L, "ghost@example.com")
                .andExpect(jsonPath("$.messages[0].text", containsString("No account found for ghost@example.com")));
        verify(emailService, never()).sendLinkPasscodeEmail(anyString(), anyString());

        chat(2001L, "/cancel")
                .andExpect(jsonPath("$.messages[0].text", containsString("Linking cancelled")));
    }

    @Test
    @DisplayName("a wrong code ends the session without merging")
    void wrongCode_noMerge() throws Exception {
        mockMvc.perform(post("/api/v1/accounts")
                        .header(API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"carol@example.com\"}"))
                .andExpect(status().isCreated());
        when(emailService.sendLinkPasscodeEmail(eq("carol@example.com"), anyString())).thenReturn(true);

        chat(3001L, "/start");
        chat(3001L, "/link");
        chat(3001L, "carol@example.com");

        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(emailService).sendLinkPasscodeEmail(eq("carol@example.com"), code.capture());
        String wrong = code.getValue().equals("000000") ? "111111" : "000000";

        chat(3001L, wrong)
                .andExpect(jsonPath("$.messages[0].text", containsString("Invalid or expired code")));

        Integer accounts = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM accounts", Integer.class);
        assertThat(accounts).isEqualTo(2);
    }
}
