package com.flagship.marketplace.transaction;

public enum PaymentStatus {
    PENDING,
    PROCESSING,
    PAID,
    FAILED,
    REFUNDED
}
