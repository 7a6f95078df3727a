package uk.gegc.questionbot.features.account.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "accounts")
@Getter
@Setter
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "chat_identity", unique = true)
    private Long chatIdentity;

    @Column(name = "chat_username", length = 255)
    private String chatUsername;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private AccountKind kind;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "free_credits", nullable = false)
    private int freeCredits;

    @Column(name = "paid_credits", nullable = false)
    private int paidCredits;

    @Column(name = "total_queries", nullable = false)
    private long totalQueries;

    @Column(name = "last_query_at")
    private LocalDateTime lastQueryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public int getTotalCredits() {
        return freeCredits + paidCredits;
    }

    /**
     * A chat identity is linked when it sits on a registered account whose email has been proven.
     */
    public boolean isLinked() {
        return kind == AccountKind.REGISTERED && emailVerified && chatIdentity != null;
    }
}
