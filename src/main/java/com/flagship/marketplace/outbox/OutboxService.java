package com.flagship.marketplace.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.marketplace.notification.NotificationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes notification events to the outbox inside the business transaction.
 *
 * If the state change commits, its notifications are guaranteed to be
 * stored; if it rolls back, they disappear with it. Dispatching happens
 * later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Must run inside the caller's transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveNotification(NotificationEvent notification) {
        OutboxEvent event = OutboxEvent.create(
                notification.getEventId(),
                notification.getAggregateType(),
                notification.getAggregateId(),
                notification.getType().name(),
                notification.getRecipientId(),
                serialize(notification),
                notification.getOccurredAt());

        repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Queued notification: type={}, aggregate={} {}, recipient={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId(), event.getRecipientId());
        return event;
    }

    /**
     * Locks and returns the next batch of undispatched events below the retry limit.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedForUpdate(maxRetries, PageRequest.of(0, limit))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now(clock));
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * @return the retry count after this failure
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    public NotificationEvent readNotification(OutboxEvent event) {
        try {
            return objectMapper.readValue(event.getPayload(), NotificationEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable outbox payload for event " + event.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional
    public int purgePublishedBefore(Instant before) {
        return repository.deletePublishedEventsBefore(before);
    }

    private String serialize(NotificationEvent notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification " + notification.getEventId(), e);
        }
    }
}
