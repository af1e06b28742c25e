package com.flagship.marketplace.offer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.offer.OfferAction;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class RespondToOfferRequest {

    @NotNull(message = "Action is required: ACCEPT or REJECT")
    @JsonProperty("action")
    OfferAction action;
}
