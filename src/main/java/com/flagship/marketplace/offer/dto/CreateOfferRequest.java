package com.flagship.marketplace.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;

/**
 * Request DTO for placing an offer. Amount rules are checked by the engine
 * so that a non-positive amount reports INVALID_AMOUNT.
 */
@Value
public class CreateOfferRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @NotNull(message = "Seller ID is required")
    @JsonProperty("seller_id")
    UUID sellerId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("note")
    String note;

    /** ISO-8601 duration, e.g. PT48H. */
    @JsonProperty("ttl")
    Duration ttl;
}
