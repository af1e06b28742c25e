package com.flagship.marketplace.evidence;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Reference to a stored evidence file. The bytes live in {@link EvidenceStorage}.
 */
@Value
@Builder
@Jacksonized
public class EvidenceRef {
    UUID id;
    UUID transactionId;
    EvidenceKind kind;
    String storageRef;
    UUID addedBy;
    Instant createdAt;
    Long sequenceNumber;

    public static EvidenceRef create(UUID transactionId, EvidenceKind kind, String storageRef,
                                     UUID addedBy, Instant now) {
        return EvidenceRef.builder()
                .id(UUID.randomUUID())
                .transactionId(transactionId)
                .kind(kind)
                .storageRef(storageRef)
                .addedBy(addedBy)
                .createdAt(now)
                .build();
    }
}
