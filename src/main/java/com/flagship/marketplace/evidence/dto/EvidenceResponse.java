package com.flagship.marketplace.evidence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.evidence.EvidenceKind;
import com.flagship.marketplace.evidence.EvidenceRef;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EvidenceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("kind")
    EvidenceKind kind;

    @JsonProperty("ref")
    String ref;

    @JsonProperty("added_by")
    UUID addedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EvidenceResponse from(EvidenceRef evidence) {
        return EvidenceResponse.builder()
            .id(evidence.getId())
            .transactionId(evidence.getTransactionId())
            .kind(evidence.getKind())
            .ref(evidence.getStorageRef())
            .addedBy(evidence.getAddedBy())
            .createdAt(evidence.getCreatedAt())
            .build();
    }
}
