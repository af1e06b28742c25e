package com.flagship.marketplace.transaction;

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
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByOpenItemId(UUID itemId);

    Optional<TransactionEntity> findByOfferId(UUID offerId);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.buyerId = :userId OR t.sellerId = :userId
        ORDER BY t.createdAt DESC
        """)
    List<TransactionEntity> findByParticipant(@Param("userId") UUID userId);

    /**
     * Delivered transactions whose delivery was recorded at or before the cutoff.
     */
    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.status = com.flagship.marketplace.transaction.TransactionStatus.DELIVERED
        AND t.deliveredAt <= :cutoff
        ORDER BY t.deliveredAt ASC
        """)
    List<TransactionEntity> findDeliveredBefore(@Param("cutoff") Instant cutoff, Pageable pageable);
}
