package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Presence of the reason is checked after authorization, by the state machine.
 */
@Value
public class CancelRequest {

    @JsonProperty("reason")
    String reason;
}
