package com.flagship.marketplace.transaction;

import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.messaging.MessagingLedger;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Side effects of an accepted transition: a system message on the
 * transaction and a notification for each party other than the actor.
 * Written in the transition's own database transaction.
 */
@Component
@RequiredArgsConstructor
public class TransitionJournal {

    private final MessagingLedger messagingLedger;
    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(Transaction transaction, Actor actor, NotificationType type, String summary, Instant now) {
        messagingLedger.appendSystemMessage(transaction.getId(), summary, now);

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("status", transaction.getStatus().name());
        payload.put("paymentStatus", transaction.getPaymentStatus().name());
        payload.put("deliveryStatus", transaction.getDeliveryStatus().name());
        payload.put("version", String.valueOf(transaction.getVersion()));
        payload.put("summary", summary);

        for (UUID recipient : List.of(transaction.getBuyerId(), transaction.getSellerId())) {
            if (actor.is(recipient)) {
                continue;
            }
            outboxService.saveNotification(NotificationEvent.create(
                    type, NotificationEvent.TRANSACTION, transaction.getId(), recipient, payload, now));
        }
    }
}
