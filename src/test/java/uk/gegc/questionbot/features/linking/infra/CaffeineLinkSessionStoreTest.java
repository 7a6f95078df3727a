package uk.gegc.questionbot.features.linking.infra;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.questionbot.features.linking.domain.LinkSession;
import uk.gegc.questionbot.features.linking.domain.LinkState;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CaffeineLinkSessionStore")
class CaffeineLinkSessionStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private CaffeineLinkSessionStore store;

    @BeforeEach
    void setUp() {
        store = new CaffeineLinkSessionStore(Duration.ofMinutes(15), 100, ticker);
    }

    @Test
    @DisplayName("sessions expire after the configured idle time")
    void find_afterTtl_isEmpty() {
        store.save(1L, LinkSession.awaitingEmail());

        advance(Duration.ofMinutes(14));
        assertThat(store.find(1L)).isPresent();

        advance(Duration.ofMinutes(2));
        assertThat(store.find(1L)).isEmpty();
    }

    @Test
    @DisplayName("saving a new state restarts the timeout")
    void save_restartsTimeout() {
        store.save(1L, LinkSession.awaitingEmail());
        advance(Duration.ofMinutes(10));
        store.save(1L, LinkSession.awaitingCode("a@example.com"));
        advance(Duration.ofMinutes(10));

        assertThat(store.find(1L)).contains(LinkSession.awaitingCode("a@example.com"));
    }

    @Test
    @DisplayName("replace moves the session on only while it is unchanged")
    void replace_isConditional() {
        LinkSession awaitingEmail = LinkSession.awaitingEmail();
        store.save(1L, awaitingEmail);

        assertThat(store.replace(1L, awaitingEmail, LinkSession.awaitingCode("a@example.com"))).isTrue();
        assertThat(store.replace(1L, awaitingEmail, LinkSession.awaitingCode("b@example.com"))).isFalse();
        assertThat(store.find(1L)).contains(LinkSession.awaitingCode("a@example.com"));
    }

    @Test
    @DisplayName("replace does not resurrect a removed or expired session")
    void replace_afterRemoveOrExpiry_fails() {
        LinkSession awaitingEmail = LinkSession.awaitingEmail();
        store.save(1L, awaitingEmail);
        store.remove(1L);
        assertThat(store.replace(1L, awaitingEmail, LinkSession.awaitingCode("a@example.com"))).isFalse();

        store.save(2L, awaitingEmail);
        advance(Duration.ofMinutes(16));
        assertThat(store.replace(2L, awaitingEmail, LinkSession.awaitingCode("a@example.com"))).isFalse();

        assertThat(store.find(1L)).isEmpty();
        assertThat(store.find(2L)).isEmpty();
    }

    @Test
    @DisplayName("terminal states are never stored")
    void save_terminalState_removes() {
        store.save(1L, LinkSession.awaitingEmail());
        store.save(1L, new LinkSession(LinkState.CANCELLED, null));

        assertThat(store.find(1L)).isEmpty();
    }

    @Test
    @DisplayName("remove returns the removed session once")
    void remove_returnsSessionOnce() {
        store.save(2L, LinkSession.awaitingEmail());

        assertThat(store.remove(2L)).contains(LinkSession.awaitingEmail());
        assertThat(store.remove(2L)).isEmpty();
    }

    @Test
    @DisplayName("sessions are isolated per chat identity")
    void sessions_isolatedPerIdentity() {
        store.save(1L, LinkSession.awaitingEmail());

        assertThat(store.find(2L)).isEmpty();
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
