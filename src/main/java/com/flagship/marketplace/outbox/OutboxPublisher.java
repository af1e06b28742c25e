package com.flagship.marketplace.outbox;

import com.flagship.marketplace.notification.NotificationDispatcher;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background publisher that hands outbox events to the {@link NotificationDispatcher}.
 *
 * - Polls undispatched events in write order
 * - Marks each event published once the dispatcher accepted it
 * - Failed dispatches increment the retry count; at {@code max-retries}
 *   the event is a dead letter and is no longer polled
 *
 * Delivery is at-least-once: an event can be dispatched again if the
 * process dies between dispatch and marking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final NotificationDispatcher dispatcher;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.retention:P7D}")
    private Duration retention;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to dispatch", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            NotificationEvent notification = outboxService.readNotification(event);
            dispatcher.emit(notification);

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (RuntimeException e) {
            log.error("Failed to dispatch event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            int retries = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (retries >= maxRetries) {
                log.error("Event {} exceeded max retries ({}), moved to dead letter. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Deletes dispatched events older than the retention period.
     */
    @Scheduled(cron = "${outbox.publisher.cleanup-cron:0 0 3 * * *}")
    public void purgePublishedEvents() {
        int deleted = outboxService.purgePublishedBefore(Instant.now(clock).minus(retention));
        if (deleted > 0) {
            log.info("Purged {} dispatched outbox events older than {}", deleted, retention);
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
