package com.flagship.marketplace.offer;

import com.flagship.marketplace.IntegrationTestSupport;
import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.transaction.PaymentStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStatus;
import com.flagship.marketplace.transaction.TransactionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class OfferEngineTest extends IntegrationTestSupport {

    @Autowired
    private OfferEngine offerEngine;

    @Autowired
    private OfferStore offerStore;

    @Autowired
    private TransactionStore transactionStore;

    private Offer offer(Listing listing, Actor from, String amount) {
        return offerEngine.createOffer(listing.getItemId(), from, listing.getSellerId(),
                new BigDecimal(amount), null, null);
    }

    private static MarketplaceException expectFailure(ErrorKind kind, org.junit.jupiter.api.function.Executable call) {
        MarketplaceException e = assertThrows(MarketplaceException.class, call);
        assertEquals(kind, e.getKind(), e.getMessage());
        return e;
    }

    @Nested
    @DisplayName("Creating offers")
    class Create {

        @Test
        @DisplayName("An offer is PENDING, normalized to the listing currency and notifies the seller")
        void createOffer() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);

            Offer offer = offerEngine.createOffer(listing.getItemId(), buyer, sellerId,
                    new BigDecimal("50"), "  Cash today?  ", Duration.ofHours(2));

            assertEquals(OfferStatus.PENDING, offer.getStatus());
            assertEquals(new BigDecimal("50.00"), offer.getAmount());
            assertEquals(CurrencyCode.USD, offer.getCurrency());
            assertEquals("Cash today?", offer.getNote());
            assertEquals(offer.getCreatedAt().plus(Duration.ofHours(2)), offer.getExpiresAt());
            assertEquals(1L, offer.getVersion());

            List<NotificationEvent> notifications = notificationsFor(NotificationEvent.OFFER, offer.getId());
            assertEquals(1, notifications.size());
            assertEquals(NotificationType.OFFER_RECEIVED, notifications.get(0).getType());
            assertEquals(sellerId, notifications.get(0).getRecipientId());
        }

        @Test
        @DisplayName("Amount must be positive")
        void nonPositiveAmount() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);

            expectFailure(ErrorKind.INVALID_AMOUNT, () -> offerEngine.createOffer(listing.getItemId(), buyer,
                    sellerId, BigDecimal.ZERO, null, null));
            expectFailure(ErrorKind.INVALID_AMOUNT, () -> offerEngine.createOffer(listing.getItemId(), buyer,
                    sellerId, new BigDecimal("-1"), null, null));
            expectFailure(ErrorKind.INVALID_AMOUNT, () -> offerEngine.createOffer(listing.getItemId(), buyer,
                    sellerId, new BigDecimal("10.001"), null, null));
            assertEquals(0, countRows("offers"));
        }

        @Test
        @DisplayName("A seller cannot make an offer on their own listing")
        void selfDealing() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);

            expectFailure(ErrorKind.SELF_DEALING, () -> offer(listing, seller, "50"));
        }

        @Test
        @DisplayName("Unknown and unavailable listings are rejected")
        void listingChecks() {
            UUID unknownItem = UUID.randomUUID();
            when(listingCatalog.get(unknownItem)).thenReturn(Optional.empty());
            expectFailure(ErrorKind.NOT_FOUND, () -> offerEngine.createOffer(unknownItem, buyer, sellerId,
                    BigDecimal.TEN, null, null));

            Listing unavailable = givenListing(sellerId, new BigDecimal("75.00"), CurrencyCode.USD,
                    DeliveryMethod.PICKUP, false);
            expectFailure(ErrorKind.INVALID_STATE, () -> offer(unavailable, buyer, "50"));

            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            expectFailure(ErrorKind.VALIDATION_ERROR, () -> offerEngine.createOffer(listing.getItemId(), buyer,
                    UUID.randomUUID(), BigDecimal.TEN, null, null));
        }

        @Test
        @DisplayName("A second offer from the same buyer supersedes the first")
        void supersede() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);

            Offer first = offer(listing, buyer, "40");
            Offer second = offer(listing, buyer, "45");

            assertEquals(OfferStatus.CANCELLED, offerStore.get(first.getId()).getStatus());
            assertEquals(OfferStatus.PENDING, second.getStatus());
            assertEquals(second.getId(), offerStore.findPending(listing.getItemId(), buyerId).orElseThrow().getId());

            assertTrue(notificationsFor(NotificationEvent.OFFER, first.getId()).stream()
                    .anyMatch(n -> n.getType() == NotificationType.OFFER_SUPERSEDED));
        }

        @Test
        @DisplayName("No offers once the item is sold")
        void itemSold() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");
            offerEngine.respondToOffer(offer.getId(), seller, OfferAction.ACCEPT);

            MarketplaceException e = expectFailure(ErrorKind.INVALID_STATE,
                    () -> offer(listing, Actor.member(UUID.randomUUID()), "80"));
            assertTrue(e.getMessage().contains("already sold"));
        }
    }

    @Nested
    @DisplayName("Responding to offers")
    class Respond {

        @Test
        @DisplayName("Accepting an offer creates a pending transaction at the offered amount")
        void acceptCreatesTransaction() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");

            OfferDecision decision = offerEngine.respondToOffer(offer.getId(), seller, OfferAction.ACCEPT);

            assertEquals(OfferStatus.ACCEPTED, decision.getOffer().getStatus());
            Transaction tx = decision.transaction().orElseThrow();
            assertEquals(new BigDecimal("50.00"), tx.getAmount());
            assertEquals(TransactionStatus.PENDING, tx.getStatus());
            assertEquals(PaymentStatus.PENDING, tx.getPaymentStatus());
            assertEquals(offer.getId(), tx.getOfferId());
            assertEquals(buyerId, tx.getBuyerId());
            assertEquals(sellerId, tx.getSellerId());
            assertEquals(DeliveryMethod.PICKUP, tx.getDeliveryMethod());

            assertEquals(tx.getId(), transactionStore.findByOffer(offer.getId()).orElseThrow().getId());
            assertTrue(notificationsFor(NotificationEvent.OFFER, offer.getId()).stream()
                    .anyMatch(n -> n.getType() == NotificationType.OFFER_ACCEPTED && n.getRecipientId().equals(buyerId)));
            assertTrue(notificationsFor(NotificationEvent.TRANSACTION, tx.getId()).stream()
                    .anyMatch(n -> n.getType() == NotificationType.TRANSACTION_CREATED && n.getRecipientId().equals(buyerId)));
        }

        @Test
        @DisplayName("Accepting one offer cancels the other pending offers on the item")
        void acceptCancelsCompetitors() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Actor otherBuyer = Actor.member(UUID.randomUUID());
            Offer winning = offer(listing, buyer, "60");
            Offer losing = offer(listing, otherBuyer, "55");

            offerEngine.respondToOffer(winning.getId(), seller, OfferAction.ACCEPT);

            assertEquals(OfferStatus.CANCELLED, offerStore.get(losing.getId()).getStatus());
            assertTrue(notificationsFor(NotificationEvent.OFFER, losing.getId()).stream()
                    .anyMatch(n -> n.getType() == NotificationType.OFFER_CANCELLED
                            && n.getRecipientId().equals(otherBuyer.getId())));
            expectFailure(ErrorKind.INVALID_STATE,
                    () -> offerEngine.respondToOffer(losing.getId(), seller, OfferAction.ACCEPT));
            assertEquals(1, countRows("marketplace_transactions"));
        }

        @Test
        @DisplayName("A failed acceptance leaves the offer PENDING and writes no transaction for it")
        void acceptRollsBack() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");
            Transaction direct = transactionStore.create(Transaction.open(null, listing.getItemId(),
                    UUID.randomUUID(), sellerId, new BigDecimal("75.00"), CurrencyCode.USD,
                    DeliveryMethod.PICKUP, null, Instant.now()));

            MarketplaceException e = expectFailure(ErrorKind.INVALID_STATE,
                    () -> offerEngine.respondToOffer(offer.getId(), seller, OfferAction.ACCEPT));
            assertTrue(e.getMessage().contains(direct.getId().toString()));

            Offer reloaded = offerStore.get(offer.getId());
            assertEquals(OfferStatus.PENDING, reloaded.getStatus());
            assertEquals(offer.getVersion(), reloaded.getVersion());
            assertTrue(transactionStore.findByOffer(offer.getId()).isEmpty());
            assertEquals(1, countRows("marketplace_transactions"));
            assertTrue(notificationsFor(NotificationEvent.OFFER, offer.getId()).stream()
                    .noneMatch(n -> n.getType() == NotificationType.OFFER_ACCEPTED));
        }

        @Test
        @DisplayName("Rejecting notifies the buyer and creates no transaction")
        void reject() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "10");

            OfferDecision decision = offerEngine.respondToOffer(offer.getId(), seller, OfferAction.REJECT);

            assertEquals(OfferStatus.REJECTED, decision.getOffer().getStatus());
            assertTrue(decision.transaction().isEmpty());
            assertEquals(0, countRows("marketplace_transactions"));
        }

        @Test
        @DisplayName("Only the seller may respond")
        void onlySeller() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");

            expectFailure(ErrorKind.NOT_AUTHORIZED,
                    () -> offerEngine.respondToOffer(offer.getId(), buyer, OfferAction.ACCEPT));
            expectFailure(ErrorKind.NOT_AUTHORIZED,
                    () -> offerEngine.respondToOffer(offer.getId(), admin, OfferAction.ACCEPT));
            expectFailure(ErrorKind.NOT_FOUND,
                    () -> offerEngine.respondToOffer(UUID.randomUUID(), seller, OfferAction.ACCEPT));
        }

        @Test
        @DisplayName("A cancelled offer cannot be accepted afterwards")
        void acceptAfterCancel() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");

            Offer cancelled = offerEngine.cancelOffer(offer.getId(), buyer);
            assertEquals(OfferStatus.CANCELLED, cancelled.getStatus());

            MarketplaceException e = expectFailure(ErrorKind.INVALID_STATE,
                    () -> offerEngine.respondToOffer(offer.getId(), seller, OfferAction.ACCEPT));
            assertTrue(e.getMessage().contains("already CANCELLED"));
            assertEquals(0, countRows("marketplace_transactions"));
        }

        @Test
        @DisplayName("Only the buyer may cancel")
        void onlyBuyerCancels() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer offer = offer(listing, buyer, "50");

            expectFailure(ErrorKind.NOT_AUTHORIZED, () -> offerEngine.cancelOffer(offer.getId(), seller));
        }
    }

    @Nested
    @DisplayName("Expiry sweep")
    class Sweep {

        @Test
        @DisplayName("Expires due offers and notifies both parties")
        void sweepExpiresDueOffers() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            Offer shortLived = offerEngine.createOffer(listing.getItemId(), buyer, sellerId,
                    new BigDecimal("50"), null, Duration.ofMinutes(5));
            Offer longLived = offerEngine.createOffer(listing.getItemId(), Actor.member(UUID.randomUUID()),
                    sellerId, new BigDecimal("55"), null, Duration.ofDays(5));

            int expired = offerEngine.sweepExpired(Instant.now().plus(Duration.ofHours(1)));

            assertEquals(1, expired);
            assertEquals(OfferStatus.EXPIRED, offerStore.get(shortLived.getId()).getStatus());
            assertEquals(OfferStatus.PENDING, offerStore.get(longLived.getId()).getStatus());

            List<NotificationEvent> notifications = notificationsFor(NotificationEvent.OFFER, shortLived.getId());
            assertEquals(2, notifications.stream().filter(n -> n.getType() == NotificationType.OFFER_EXPIRED).count());
        }

        @Test
        @DisplayName("A second sweep finds nothing to do")
        void sweepIsRepeatable() {
            Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
            offerEngine.createOffer(listing.getItemId(), buyer, sellerId, new BigDecimal("50"), null,
                    Duration.ofMinutes(1));
            Instant later = Instant.now().plus(Duration.ofHours(1));

            assertEquals(1, offerEngine.sweepExpired(later));
            assertEquals(0, offerEngine.sweepExpired(later));
        }
    }

    @Test
    @DisplayName("Parties and administrators can read an offer, others cannot")
    void visibility() {
        Listing listing = givenListing("75.00", DeliveryMethod.PICKUP);
        Offer offer = offer(listing, buyer, "50");

        assertEquals(offer.getId(), offerEngine.getOffer(offer.getId(), seller).getId());
        assertEquals(offer.getId(), offerEngine.getOffer(offer.getId(), admin).getId());
        expectFailure(ErrorKind.NOT_AUTHORIZED,
                () -> offerEngine.getOffer(offer.getId(), Actor.member(UUID.randomUUID())));

        assertEquals(1, offerEngine.listForUser(buyer).size());
        assertEquals(1, offerEngine.listForUser(seller).size());
    }
}
