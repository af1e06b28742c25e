package com.flagship.marketplace.evidence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EvidenceRepository extends JpaRepository<EvidenceEntity, UUID> {

    List<EvidenceEntity> findByTransactionIdOrderBySequenceNumberAsc(UUID transactionId);

    List<EvidenceEntity> findByTransactionIdAndKindOrderBySequenceNumberAsc(UUID transactionId, EvidenceKind kind);

    Optional<EvidenceEntity> findByTransactionIdAndStorageRef(UUID transactionId, String storageRef);

    boolean existsByTransactionIdAndStorageRef(UUID transactionId, String storageRef);
}
