package com.flagship.marketplace.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting in the outbox.
 *
 * Written in the same database transaction as the state change it
 * describes and dispatched afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Offer" or "Transaction"
    UUID aggregateId;
    String eventType;          // NotificationType name
    UUID recipientId;
    String payload;            // serialized NotificationEvent
    Instant createdAt;
    Instant publishedAt;       // null until dispatched
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(UUID id, String aggregateType, UUID aggregateId, String eventType,
                                     UUID recipientId, String payload, Instant createdAt) {
        return new OutboxEvent(
            id,
            aggregateType,
            aggregateId,
            eventType,
            recipientId,
            payload,
            createdAt,
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
