package com.flagship.marketplace.transaction;

import com.flagship.marketplace.store.VersionedEntityStore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for transactions.
 */
@Component
public class TransactionStore extends VersionedEntityStore<Transaction, TransactionEntity> {

    private final TransactionRepository repository;

    public TransactionStore(TransactionRepository repository) {
        super(TransactionEntity.class, "Transaction");
        this.repository = repository;
    }

    @Override
    protected TransactionEntity newEntity(Transaction transaction) {
        return TransactionEntity.fromDomain(transaction);
    }

    /**
     * The sale currently holding the item, if any.
     */
    @Transactional(readOnly = true)
    public Optional<Transaction> findOpenForItem(UUID itemId) {
        return repository.findByOpenItemId(itemId).map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByOffer(UUID offerId) {
        return repository.findByOfferId(offerId).map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Transaction> findByParticipant(UUID userId) {
        return repository.findByParticipant(userId).stream()
                .map(TransactionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Transaction> findDeliveredBefore(Instant cutoff, int limit) {
        return repository.findDeliveredBefore(cutoff, PageRequest.of(0, limit)).stream()
                .map(TransactionEntity::toDomain)
                .toList();
    }
}
