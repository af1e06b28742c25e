package com.flagship.marketplace.evidence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.evidence.EvidenceKind;
import lombok.Value;

@Value
public class AddEvidenceRequest {

    @JsonProperty("kind")
    EvidenceKind kind;

    @JsonProperty("ref")
    String ref;
}
