package com.flagship.marketplace.evidence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "evidence_refs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EvidenceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 20)
    private EvidenceKind kind;

    @Column(name = "storage_ref", nullable = false, updatable = false)
    private String storageRef;

    @Column(name = "added_by", nullable = false, updatable = false)
    private UUID addedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    public static EvidenceEntity fromDomain(EvidenceRef evidence) {
        EvidenceEntity entity = new EvidenceEntity();
        entity.id = evidence.getId();
        entity.transactionId = evidence.getTransactionId();
        entity.kind = evidence.getKind();
        entity.storageRef = evidence.getStorageRef();
        entity.addedBy = evidence.getAddedBy();
        entity.createdAt = evidence.getCreatedAt();
        return entity;
    }

    public EvidenceRef toDomain() {
        return EvidenceRef.builder()
                .id(id)
                .transactionId(transactionId)
                .kind(kind)
                .storageRef(storageRef)
                .addedBy(addedBy)
                .createdAt(createdAt)
                .sequenceNumber(sequenceNumber)
                .build();
    }
}
