package uk.gegc.questionbot.features.chat.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Chat surface configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "app.chat")
@Validated
@Data
public class ChatBotProperties {

    @Positive
    private int minTopicLength = 5;

    @Positive
    private int maxTopicLength = 500;

    /**
     * Longest text sent in one chat message; longer texts are split.
     */
    @Positive
    private int messageChunkSize = 4000;

    /**
     * Hosted checkout page where credits are bought.
     */
    @NotBlank
    private String checkoutUrl = "https://upscpredictor.in/pricing";

    @NotBlank
    private String webUrl = "https://upscpredictor.in";

    @NotBlank
    private String pricePerCredit = "₹12";

    private String supportContact = "@writernical";
}
