package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.transaction.DeliveryStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class DeliveryStatusRequest {

    @NotNull(message = "Delivery status is required")
    @JsonProperty("delivery_status")
    DeliveryStatus deliveryStatus;
}
