package uk.gegc.questionbot.features.linking.infra;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.questionbot.features.linking.domain.LinkSessionStore;

import java.time.Duration;

@Configuration
public class LinkSessionStoreConfig {

    @Bean
    public LinkSessionStore linkSessionStore(
            @Value("${app.chat.link-session.ttl:PT15M}") Duration ttl,
            @Value("${app.chat.link-session.max-size:100000}") long maxSize
    ) {
        return new CaffeineLinkSessionStore(ttl, maxSize);
    }
}
