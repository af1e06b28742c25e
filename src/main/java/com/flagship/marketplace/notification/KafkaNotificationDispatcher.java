package com.flagship.marketplace.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.marketplace.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes notification events to Kafka for the notification service.
 *
 * The aggregate id is the record key, so events for one offer or
 * transaction land on one partition in order. The send is awaited so the
 * outbox only marks an event published once the broker acknowledged it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.notifications:marketplace-notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Override
    public void emit(NotificationEvent event) {
        String value;
        try {
            value = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("Failed to serialize notification " + event.getEventId(), e);
        }

        ProducerRecord<String, String> record =
                new ProducerRecord<>(notificationsTopic, event.getAggregateId().toString(), value);
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Dispatched notification: eventId={}, type={}, recipient={}, partition={}, offset={}",
                    event.getEventId(), event.getType(), event.getRecipientId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Interrupted while dispatching " + event.getEventId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NotificationDeliveryException("Failed to dispatch notification " + event.getEventId(), e);
        }
    }
}
