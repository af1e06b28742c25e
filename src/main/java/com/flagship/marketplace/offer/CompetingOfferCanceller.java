package com.flagship.marketplace.offer;

import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Cancels the remaining pending offers on an item once it has been sold,
 * inside the unit of work that creates the sale.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompetingOfferCanceller {

    private final OfferStore offerStore;
    private final OutboxService outboxService;

    /**
     * @param keepOfferId offer that produced the sale, left untouched; null for a direct purchase
     * @return number of offers cancelled
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int cancelPendingOffers(UUID itemId, UUID keepOfferId, UUID transactionId, Instant now) {
        int cancelled = 0;
        for (Offer offer : offerStore.findPendingForItem(itemId)) {
            if (offer.getId().equals(keepOfferId)) {
                continue;
            }
            offerStore.update(offer.getId(), offer.getVersion(), current -> current.cancel(now));
            outboxService.saveNotification(NotificationEvent.create(
                    NotificationType.OFFER_CANCELLED,
                    NotificationEvent.OFFER,
                    offer.getId(),
                    offer.getBuyerId(),
                    Map.of("reason", "Item sold", "transactionId", transactionId.toString()),
                    now));
            cancelled++;
        }
        if (cancelled > 0) {
            log.info("Cancelled {} competing offers: itemId={}, transactionId={}", cancelled, itemId, transactionId);
        }
        return cancelled;
    }
}
