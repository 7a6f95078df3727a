package uk.gegc.questionbot.features.credit.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.questionbot.features.credit.domain.model.CreditTransaction;
import uk.gegc.questionbot.features.credit.domain.model.CreditTransactionType;

import java.util.List;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    List<CreditTransaction> findByAccountIdOrderByCreatedAtAsc(UUID accountId);

    long countByAccountIdAndType(UUID accountId, CreditTransactionType type);
}
