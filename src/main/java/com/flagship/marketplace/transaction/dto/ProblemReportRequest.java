package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ProblemReportRequest {

    @JsonProperty("description")
    String description;
}
