package com.flagship.marketplace.messaging;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, UUID> {

    /**
     * Keyset page: messages after {@code after} up to and including {@code upTo}, oldest first.
     */
    @Query("SELECT m FROM MessageEntity m WHERE m.transactionId = :transactionId " +
           "AND m.sequenceNumber > :after AND m.sequenceNumber <= :upTo " +
           "ORDER BY m.sequenceNumber ASC")
    List<MessageEntity> findPage(@Param("transactionId") UUID transactionId,
                                 @Param("after") long after,
                                 @Param("upTo") long upTo,
                                 Pageable pageable);

    @Query("SELECT MAX(m.sequenceNumber) FROM MessageEntity m WHERE m.transactionId = :transactionId")
    Optional<Long> findMaxSequence(@Param("transactionId") UUID transactionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE MessageEntity m SET m.readAt = :readAt WHERE m.transactionId = :transactionId " +
           "AND m.senderId <> :readerId AND m.readAt IS NULL")
    int markReadFor(@Param("transactionId") UUID transactionId,
                    @Param("readerId") UUID readerId,
                    @Param("readAt") Instant readAt);
}
