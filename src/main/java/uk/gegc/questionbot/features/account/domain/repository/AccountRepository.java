package uk.gegc.questionbot.features.account.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.questionbot.features.account.domain.model.Account;

import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByChatIdentity(Long chatIdentity);

    Optional<Account> findByEmail(String email);

    boolean existsByEmail(String email);

    // Id-only lookups keep entities out of the persistence context until they are locked
    @Query("SELECT a.id FROM Account a WHERE a.chatIdentity = :chatIdentity")
    Optional<UUID> findIdByChatIdentity(@Param("chatIdentity") Long chatIdentity);

    @Query("SELECT a.id FROM Account a WHERE a.email = :email")
    Optional<UUID> findIdByEmail(@Param("email") String email);

    /**
     * Row-locks the account for a read-modify-write of its balance. Callers locking more than one
     * account must acquire them in ascending id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.id = :id")
    Optional<Account> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Locking read by chat identity. Being a current read it sees a binding committed after the
     * surrounding transaction started, unlike {@link #findIdByChatIdentity}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.chatIdentity = :chatIdentity")
    Optional<Account> findByChatIdentityForUpdate(@Param("chatIdentity") Long chatIdentity);
}
