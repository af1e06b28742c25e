package com.flagship.marketplace.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Kafka consumer for the payment collaborator's events.
 *
 * This consumer:
 * 1. Receives events from the payments topic
 * 2. Parses the JSON envelope {eventId, eventType, transactionId, reason}
 * 3. Routes events through {@link IdempotentEventProcessor} to {@link PaymentEventHandler}
 * 4. Acknowledges manually, only after processing committed
 *
 * Unparseable messages are acknowledged and dropped; a failing handler
 * leaves the message unacknowledged so it is redelivered. The listener only
 * starts when {@code consumer.enabled} is true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventConsumer {

    static final String CONSUMER_GROUP = "marketplace-payment-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final PaymentEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payments:marketplace-payments}",
        groupId = "${spring.kafka.consumer.group-id:" + CONSUMER_GROUP + "}",
        autoStartup = "${consumer.enabled:true}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Header correlation = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(
                correlation != null ? new String(correlation.value(), StandardCharsets.UTF_8) : null);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());

        try {
            handle(record.value());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    /**
     * Parses and routes one message.
     *
     * @return true if the event changed a transaction
     */
    public boolean handle(String payload) {
        EventEnvelope envelope = parseEvent(payload);
        if (envelope == null) {
            log.warn("Could not parse payment event, dropping: {}", payload);
            return false;
        }

        boolean[] changed = {false};
        Runnable handler = switch (envelope.eventType()) {
            case "PaymentConfirmed" -> () -> changed[0] = eventHandler.onPaymentConfirmed(envelope.transactionId());
            case "PaymentProcessing" -> () -> changed[0] = eventHandler.onPaymentProcessing(envelope.transactionId());
            case "PaymentFailed" -> () -> changed[0] =
                    eventHandler.onPaymentFailed(envelope.transactionId(), envelope.reason());
            default -> null;
        };

        if (handler == null) {
            eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), NotificationEvent.TRANSACTION,
                    envelope.transactionId(), CONSUMER_GROUP, "Unknown event type");
            log.debug("Unknown payment event type {}, skipped", envelope.eventType());
            return false;
        }

        boolean processed = eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                NotificationEvent.TRANSACTION, envelope.transactionId(), CONSUMER_GROUP, handler);
        if (processed) {
            log.info("Processed payment event: type={}, eventId={}, transactionId={}, changed={}",
                    envelope.eventType(), envelope.eventId(), envelope.transactionId(), changed[0]);
        }
        return changed[0];
    }

    private EventEnvelope parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            UUID transactionId = UUID.fromString(node.get("transactionId").asText());
            String eventType = node.path("eventType").asText("Unknown");
            String reason = node.hasNonNull("reason") ? node.get("reason").asText() : null;
            return new EventEnvelope(eventId, eventType, transactionId, reason);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private record EventEnvelope(UUID eventId, String eventType, UUID transactionId, String reason) {}
}
