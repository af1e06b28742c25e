package com.flagship.marketplace.error;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    boolean retryable;
    Map<String, String> details;
    Instant timestamp;
}
