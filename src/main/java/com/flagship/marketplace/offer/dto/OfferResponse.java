package com.flagship.marketplace.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.offer.Offer;
import com.flagship.marketplace.offer.OfferStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OfferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("seller_id")
    UUID sellerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    OfferStatus status;

    @JsonProperty("note")
    String note;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    long version;

    public static OfferResponse from(Offer offer) {
        return OfferResponse.builder()
            .id(offer.getId())
            .itemId(offer.getItemId())
            .buyerId(offer.getBuyerId())
            .sellerId(offer.getSellerId())
            .amount(offer.getAmount())
            .currency(offer.getCurrency().name())
            .status(offer.getStatus())
            .note(offer.getNote())
            .expiresAt(offer.getExpiresAt())
            .createdAt(offer.getCreatedAt())
            .updatedAt(offer.getUpdatedAt())
            .version(offer.getVersion())
            .build();
    }
}
