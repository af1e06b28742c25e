package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.transaction.DisputeOutcome;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ResolveDisputeRequest {

    @NotNull(message = "Outcome is required: RELEASE or REFUND")
    @JsonProperty("outcome")
    DisputeOutcome outcome;
}
