package com.flagship.marketplace.messaging.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PostMessageRequest {

    @JsonProperty("message")
    String message;
}
