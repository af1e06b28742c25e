package com.flagship.marketplace.offer;

import com.flagship.marketplace.store.VersionedEntityStore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for offers.
 */
@Component
public class OfferStore extends VersionedEntityStore<Offer, OfferEntity> {

    private final OfferRepository repository;

    public OfferStore(OfferRepository repository) {
        super(OfferEntity.class, "Offer");
        this.repository = repository;
    }

    @Override
    protected OfferEntity newEntity(Offer offer) {
        return OfferEntity.fromDomain(offer);
    }

    @Transactional(readOnly = true)
    public Optional<Offer> findPending(UUID itemId, UUID buyerId) {
        return repository.findByPendingKey(OfferEntity.pendingKey(itemId, buyerId)).map(OfferEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Offer> findPendingForItem(UUID itemId) {
        return repository.findByItemIdAndStatusOrderByCreatedAtAsc(itemId, OfferStatus.PENDING).stream()
                .map(OfferEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Offer> findExpirable(Instant now, int limit) {
        return repository.findExpirable(now, PageRequest.of(0, limit)).stream()
                .map(OfferEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Offer> findByParticipant(UUID userId) {
        return repository.findByParticipant(userId).stream()
                .map(OfferEntity::toDomain)
                .toList();
    }
}
