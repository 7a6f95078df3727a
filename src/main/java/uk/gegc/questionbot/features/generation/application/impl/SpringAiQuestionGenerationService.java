package uk.gegc.questionbot.features.generation.application.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import uk.gegc.questionbot.features.generation.application.QuestionGenerationService;
import uk.gegc.questionbot.shared.exception.AiServiceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-shot generation through Spring AI. No retries: a failure goes straight back to the user,
 * who can resend the topic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiQuestionGenerationService implements QuestionGenerationService {

    private final ChatClient chatClient;

    @Value("${app.generation.system-prompt:classpath:prompts/question-set-system.txt}")
    private Resource systemPromptResource;

    private String systemPrompt;

    @PostConstruct
    void loadSystemPrompt() {
        try (var inputStream = systemPromptResource.getInputStream()) {
            this.systemPrompt = StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load question set system prompt from "
                    + systemPromptResource.getDescription(), e);
        }
        if (systemPrompt.isBlank()) {
            throw new IllegalStateException("Question set system prompt is empty");
        }
    }

    @Override
    public String generate(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new AiServiceException("Topic cannot be null or empty");
        }
        Instant start = Instant.now();

        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user("Generate UPSC questions for: " + topic)
                    .call()
                    .chatResponse();
        } catch (Exception e) {
            log.error("Question generation failed for topic of length {}", topic.length(), e);
            throw new AiServiceException("Question generation failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AiServiceException("No response received from AI service");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new AiServiceException("AI service returned an empty question set");
        }

        log.info("Question set generated - Model: {}, Latency: {}ms",
                response.getMetadata() != null ? response.getMetadata().getModel() : "unknown",
                Duration.between(start, Instant.now()).toMillis());
        return text;
    }
}
