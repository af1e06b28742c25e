package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class PurchaseRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    /** Required when the listing is sold with delivery. */
    @JsonProperty("delivery_address")
    String deliveryAddress;
}
