package uk.gegc.questionbot.features.linking.domain;

import java.util.Optional;

/**
 * In-memory link sessions keyed by chat identity. Entries expire on their own; an expired session
 * reads as absent.
 */
public interface LinkSessionStore {

    Optional<LinkSession> find(long chatIdentity);

    void save(long chatIdentity, LinkSession session);

    /**
     * Moves the session on only if it still equals {@code expected}. A terminal {@code next} removes it.
     *
     * @return {@code false} if the session was cancelled, expired or changed in the meantime
     */
    boolean replace(long chatIdentity, LinkSession expected, LinkSession next);

    Optional<LinkSession> remove(long chatIdentity);
}
