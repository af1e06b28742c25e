package com.flagship.marketplace.offer;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OfferRepository extends JpaRepository<OfferEntity, UUID> {

    Optional<OfferEntity> findByPendingKey(String pendingKey);

    List<OfferEntity> findByItemIdAndStatusOrderByCreatedAtAsc(UUID itemId, OfferStatus status);

    /**
     * Pending offers whose expiry has passed, oldest expiry first.
     */
    @Query("""
        SELECT o FROM OfferEntity o
        WHERE o.status = com.flagship.marketplace.offer.OfferStatus.PENDING
        AND o.expiresAt IS NOT NULL
        AND o.expiresAt <= :now
        ORDER BY o.expiresAt ASC
        """)
    List<OfferEntity> findExpirable(@Param("now") Instant now, Pageable pageable);

    @Query("""
        SELECT o FROM OfferEntity o
        WHERE o.buyerId = :userId OR o.sellerId = :userId
        ORDER BY o.createdAt DESC
        """)
    List<OfferEntity> findByParticipant(@Param("userId") UUID userId);
}
