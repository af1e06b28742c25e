package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class TrackingNumberRequest {

    @JsonProperty("tracking_number")
    String trackingNumber;
}
