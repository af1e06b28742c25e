package com.flagship.marketplace.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an inbound event handled by a consumer group.
 *
 * Its presence is what makes redelivered events harmless: the
 * (eventId, consumerGroup) pair is unique.
 */
@Value
public class ProcessedEvent {
    UUID id;
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        /** Handler ran and its effects committed with this record. */
        SUCCESS,
        /** Event not relevant to this consumer. */
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now) {
        return new ProcessedEvent(UUID.randomUUID(), eventId, eventType, aggregateType, aggregateId,
                consumerGroup, now, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now, String reason) {
        return new ProcessedEvent(UUID.randomUUID(), eventId, eventType, aggregateType, aggregateId,
                consumerGroup, now, ProcessingResult.SKIPPED, reason);
    }
}
