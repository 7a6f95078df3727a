package uk.gegc.questionbot.features.otp.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbot.features.otp.domain.model.OneTimePasscode;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface OneTimePasscodeRepository extends JpaRepository<OneTimePasscode, UUID> {

    @Query("""
        SELECT o FROM OneTimePasscode o
        WHERE o.email = :email AND o.codeHash = :codeHash
          AND o.used = false AND o.expiresAt >= :now
        ORDER BY o.issuedAt DESC
        """)
    List<OneTimePasscode> findRedeemable(@Param("email") String email,
                                         @Param("codeHash") String codeHash,
                                         @Param("now") LocalDateTime now);

    /**
     * Consumes the passcode if it is still unused and unexpired.
     *
     * @return 1 if this call consumed it, 0 if it was already used or has expired
     */
    @Modifying
    @Transactional
    @Query("""
        UPDATE OneTimePasscode o
        SET o.used = true
        WHERE o.id = :id AND o.used = false AND o.expiresAt >= :now
        """)
    int markUsedIfValid(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("DELETE FROM OneTimePasscode o WHERE o.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") LocalDateTime cutoff);

    long countByEmail(String email);
}
