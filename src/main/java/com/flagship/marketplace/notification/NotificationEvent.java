package com.flagship.marketplace.notification;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A notification for one recipient about an offer or a transaction.
 *
 * One event is produced per recipient. {@code aggregateType} is "Offer" or
 * "Transaction" and {@code aggregateId} the corresponding id.
 */
@Value
@Builder
@Jacksonized
public class NotificationEvent {

    public static final String OFFER = "Offer";
    public static final String TRANSACTION = "Transaction";

    UUID eventId;
    NotificationType type;
    String aggregateType;
    UUID aggregateId;
    UUID recipientId;
    Map<String, String> payload;
    Instant occurredAt;

    public static NotificationEvent create(NotificationType type, String aggregateType, UUID aggregateId,
                                           UUID recipientId, Map<String, String> payload, Instant now) {
        return NotificationEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .recipientId(recipientId)
                .payload(payload)
                .occurredAt(now)
                .build();
    }
}
