package com.flagship.marketplace.notification;

public enum NotificationType {
    OFFER_RECEIVED,
    OFFER_SUPERSEDED,
    OFFER_ACCEPTED,
    OFFER_REJECTED,
    OFFER_CANCELLED,
    OFFER_EXPIRED,
    TRANSACTION_CREATED,
    PAYMENT_UPDATED,
    DELIVERY_UPDATED,
    TRANSACTION_COMPLETED,
    TRANSACTION_CANCELLED,
    PROBLEM_REPORTED,
    TRANSACTION_REFUNDED,
    DISPUTE_RESOLVED,
    EVIDENCE_ADDED,
    EVIDENCE_REMOVED,
    MESSAGE_POSTED
}
