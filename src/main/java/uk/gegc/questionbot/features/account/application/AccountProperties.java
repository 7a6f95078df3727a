package uk.gegc.questionbot.features.account.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Account defaults for identities first seen on the chat surface.
 */
@Configuration
@ConfigurationProperties(prefix = "app.account")
@Validated
@Data
public class AccountProperties {

    /**
     * Free credits granted to a chat identity on first contact.
     */
    @PositiveOrZero
    private int freeCreditsOnSignup = 1;

    /**
     * Reserved domain of synthetic emails, e.g. {@code tg_42@telegram.placeholder}.
     * Never accepted as user input.
     */
    @NotBlank
    private String placeholderDomain = "telegram.placeholder";

    public String placeholderEmailFor(long chatIdentity) {
        return "tg_" + chatIdentity + "@" + placeholderDomain;
    }
}
