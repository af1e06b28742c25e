package com.flagship.marketplace.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.offer.OfferDecision;
import com.flagship.marketplace.transaction.dto.TransactionResponse;
import lombok.Value;

import java.util.List;

@Value
public class OfferDecisionResponse {

    @JsonProperty("offer")
    OfferResponse offer;

    /** Present when the offer was accepted. */
    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static OfferDecisionResponse from(OfferDecision decision) {
        return new OfferDecisionResponse(
            OfferResponse.from(decision.getOffer()),
            decision.transaction().map(tx -> TransactionResponse.from(tx, List.of())).orElse(null));
    }
}
