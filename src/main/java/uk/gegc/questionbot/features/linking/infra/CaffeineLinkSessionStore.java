package uk.gegc.questionbot.features.linking.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import uk.gegc.questionbot.features.linking.domain.LinkSession;
import uk.gegc.questionbot.features.linking.domain.LinkSessionStore;

import java.time.Duration;
import java.util.Optional;

public class CaffeineLinkSessionStore implements LinkSessionStore {

    private final Cache<Long, LinkSession> sessions;

    public CaffeineLinkSessionStore(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    CaffeineLinkSessionStore(Duration ttl, long maxSize, Ticker ticker) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<LinkSession> find(long chatIdentity) {
        return Optional.ofNullable(sessions.getIfPresent(chatIdentity));
    }

    @Override
    public void save(long chatIdentity, LinkSession session) {
        if (session.state().isTerminal()) {
            sessions.invalidate(chatIdentity);
            return;
        }
        sessions.put(chatIdentity, session);
    }

    @Override
    public boolean replace(long chatIdentity, LinkSession expected, LinkSession next) {
        if (next.state().isTerminal()) {
            return sessions.asMap().remove(chatIdentity, expected);
        }
        return sessions.asMap().replace(chatIdentity, expected, next);
    }

    @Override
    public Optional<LinkSession> remove(long chatIdentity) {
        return Optional.ofNullable(sessions.asMap().remove(chatIdentity));
    }
}
