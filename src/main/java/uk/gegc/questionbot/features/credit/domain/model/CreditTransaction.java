package uk.gegc.questionbot.features.credit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only audit of balance changes. Balances are never derived from it.
 */
@Entity
@Table(name = "credit_transactions")
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private CreditTransactionType type;

    @Column(name = "free_delta", nullable = false)
    private int freeDelta;

    @Column(name = "paid_delta", nullable = false)
    private int paidDelta;

    @Column(name = "balance_after_free", nullable = false)
    private int balanceAfterFree;

    @Column(name = "balance_after_paid", nullable = false)
    private int balanceAfterPaid;

    @Column(name = "reference", length = 255)
    private String reference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
