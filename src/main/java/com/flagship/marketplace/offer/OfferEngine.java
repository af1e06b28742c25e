package com.flagship.marketplace.offer;

import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.error.VersionConflictException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.listing.ListingCatalog;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.observability.CorrelationContext;
import com.flagship.marketplace.observability.MarketplaceMetrics;
import com.flagship.marketplace.outbox.OutboxService;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStateMachine;
import com.flagship.marketplace.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Offer negotiation: creation, seller response, buyer cancellation and expiry.
 *
 * <ul>
 *   <li>At most one pending offer per item and buyer: a new offer cancels
 *   the previous one in the same unit of work, and the pending-offer unique
 *   key turns a concurrent duplicate into a version conflict.</li>
 *   <li>Accepting an offer marks it ACCEPTED and creates its transaction in
 *   one database transaction; the item's other pending offers are cancelled
 *   with it.</li>
 *   <li>The expiry sweep only touches pending offers through version-checked
 *   updates; when a user action wins the race the sweep skips that offer.</li>
 * </ul>
 */
@Service
@Slf4j
public class OfferEngine {

    private final OfferStore offerStore;
    private final TransactionStore transactionStore;
    private final TransactionStateMachine stateMachine;
    private final CompetingOfferCanceller competingOfferCanceller;
    private final ListingCatalog listingCatalog;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxNoteLength;
    private final int sweepBatchSize;

    public OfferEngine(OfferStore offerStore,
                       TransactionStore transactionStore,
                       TransactionStateMachine stateMachine,
                       CompetingOfferCanceller competingOfferCanceller,
                       ListingCatalog listingCatalog,
                       OutboxService outboxService,
                       MarketplaceMetrics metrics,
                       PlatformTransactionManager transactionManager,
                       Clock clock,
                       @Value("${marketplace.offers.default-ttl:P3D}") Duration defaultTtl,
                       @Value("${marketplace.offers.max-note-length:1000}") int maxNoteLength,
                       @Value("${marketplace.offers.sweep-batch-size:500}") int sweepBatchSize) {
        this.offerStore = offerStore;
        this.transactionStore = transactionStore;
        this.stateMachine = stateMachine;
        this.competingOfferCanceller = competingOfferCanceller;
        this.listingCatalog = listingCatalog;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxNoteLength = maxNoteLength;
        this.sweepBatchSize = sweepBatchSize;
    }

    /**
     * Places an offer on a listing.
     *
     * @param ttl time until the offer expires; the configured default when null
     */
    @Transactional
    public Offer createOffer(UUID itemId, Actor buyer, UUID sellerId, BigDecimal amount, String note, Duration ttl) {
        return metrics.record("offer.create", () -> {
            if (amount == null || amount.signum() <= 0) {
                throw MarketplaceException.invalidAmount("Offer amount must be greater than zero");
            }
            if (buyer.is(sellerId)) {
                throw MarketplaceException.selfDealing(buyer.getId());
            }
            Duration lifetime = ttl != null ? ttl : defaultTtl;
            if (lifetime.isZero() || lifetime.isNegative()) {
                throw MarketplaceException.validation("Offer time to live must be positive");
            }
            String trimmedNote = note == null || note.isBlank() ? null : note.strip();
            if (trimmedNote != null && trimmedNote.length() > maxNoteLength) {
                throw MarketplaceException.validation(
                        String.format("Offer note exceeds %d characters", maxNoteLength));
            }

            Listing listing = listingCatalog.get(itemId)
                    .orElseThrow(() -> MarketplaceException.notFound("Listing", itemId));
            if (!listing.getSellerId().equals(sellerId)) {
                throw MarketplaceException.validation(
                        String.format("User %s is not the seller of listing %s", sellerId, itemId));
            }
            if (!listing.isAvailable()) {
                throw MarketplaceException.invalidState(
                        String.format("Listing %s is not accepting offers", itemId));
            }
            transactionStore.findOpenForItem(itemId).ifPresent(open -> {
                throw MarketplaceException.invalidState(
                        String.format("Item %s already sold in transaction %s", itemId, open.getId()));
            });
            BigDecimal normalized = normalizeAmount(amount, listing.getCurrency());

            Instant now = now();
            offerStore.findPending(itemId, buyer.getId()).ifPresent(previous -> supersede(previous, now));

            Offer created = offerStore.create(Offer.create(itemId, buyer.getId(), sellerId, normalized,
                    listing.getCurrency(), trimmedNote, now.plus(lifetime), now));

            return withOfferContext(created.getId(), () -> {
                notify(created, NotificationType.OFFER_RECEIVED, created.getSellerId(), now);
                log.info("Offer created: itemId={}, buyer={}, amount={} {}, expiresAt={}",
                        itemId, buyer.getId(), created.getAmount(), created.getCurrency(), created.getExpiresAt());
                return created;
            });
        });
    }

    /**
     * Seller accepts or rejects a pending offer.
     */
    @Transactional
    public OfferDecision respondToOffer(UUID offerId, Actor actor, OfferAction action) {
        return metrics.record("offer.respond", () -> withOfferContext(offerId, () -> {
            Offer offer = offerStore.get(offerId);
            if (!actor.is(offer.getSellerId())) {
                throw MarketplaceException.notAuthorized(
                        String.format("Only the seller can respond to offer %s", offerId));
            }
            if (action == null) {
                throw MarketplaceException.validation("Action is required: ACCEPT or REJECT");
            }
            return action == OfferAction.ACCEPT ? accept(offer, actor) : reject(offer);
        }));
    }

    @Transactional
    public Offer cancelOffer(UUID offerId, Actor actor) {
        return metrics.record("offer.cancel", () -> withOfferContext(offerId, () -> {
            Offer offer = offerStore.get(offerId);
            if (!actor.is(offer.getBuyerId())) {
                throw MarketplaceException.notAuthorized(
                        String.format("Only the buyer can cancel offer %s", offerId));
            }
            Instant now = now();
            Offer cancelled = update(offer, current -> current.cancel(now));
            notify(cancelled, NotificationType.OFFER_CANCELLED, cancelled.getSellerId(), now);

            log.info("Offer cancelled by buyer: offerId={}", offerId);
            return cancelled;
        }));
    }

    @Transactional(readOnly = true)
    public Offer getOffer(UUID offerId, Actor actor) {
        Offer offer = offerStore.get(offerId);
        if (!actor.isAdministrator() && !actor.is(offer.getBuyerId()) && !actor.is(offer.getSellerId())) {
            throw MarketplaceException.notAuthorized(
                    String.format("User %s cannot view offer %s", actor.getId(), offerId));
        }
        return offer;
    }

    @Transactional(readOnly = true)
    public List<Offer> listForUser(Actor actor) {
        return offerStore.findByParticipant(actor.getId());
    }

    /**
     * Expires every pending offer whose expiry has passed. Each offer is
     * expired in its own database transaction; offers changed concurrently
     * by a user are skipped.
     *
     * @return number of offers expired by this call
     */
    public int sweepExpired(Instant now) {
        int expired = 0;
        while (true) {
            List<Offer> batch = offerStore.findExpirable(now, sweepBatchSize);
            int expiredInBatch = 0;
            for (Offer offer : batch) {
                if (expireOne(offer, now)) {
                    expiredInBatch++;
                }
            }
            expired += expiredInBatch;
            if (batch.size() < sweepBatchSize || expiredInBatch == 0) {
                break;
            }
        }
        if (expired > 0) {
            metrics.recordOffersExpired(expired);
            log.info("Expired {} offers at {}", expired, now);
        }
        return expired;
    }

    private boolean expireOne(Offer offer, Instant now) {
        try {
            return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
                Offer expired = offerStore.update(offer.getId(), offer.getVersion(), current -> current.expire(now));
                notify(expired, NotificationType.OFFER_EXPIRED, expired.getBuyerId(), now);
                notify(expired, NotificationType.OFFER_EXPIRED, expired.getSellerId(), now);
                return true;
            }));
        } catch (VersionConflictException e) {
            log.debug("Offer {} changed during expiry sweep, skipped", offer.getId());
            return false;
        } catch (MarketplaceException e) {
            if (e.getKind() != ErrorKind.INVALID_STATE) {
                throw e;
            }
            log.debug("Offer {} no longer expirable: {}", offer.getId(), e.getMessage());
            return false;
        }
    }

    private OfferDecision accept(Offer offer, Actor seller) {
        // listing is read before any row is written
        Listing listing = listingCatalog.get(offer.getItemId())
                .orElseThrow(() -> MarketplaceException.notFound("Listing", offer.getItemId()));

        Instant now = now();
        Offer accepted = update(offer, current -> current.accept(now));
        Transaction transaction = stateMachine.createFromOffer(accepted, listing, seller);
        competingOfferCanceller.cancelPendingOffers(accepted.getItemId(), accepted.getId(), transaction.getId(), now);

        notify(accepted, NotificationType.OFFER_ACCEPTED, accepted.getBuyerId(), now);
        log.info("Offer accepted: offerId={}, transactionId={}, amount={} {}",
                accepted.getId(), transaction.getId(), accepted.getAmount(), accepted.getCurrency());
        return OfferDecision.accepted(accepted, transaction);
    }

    private OfferDecision reject(Offer offer) {
        Instant now = now();
        Offer rejected = update(offer, current -> current.reject(now));
        notify(rejected, NotificationType.OFFER_REJECTED, rejected.getBuyerId(), now);

        log.info("Offer rejected: offerId={}", rejected.getId());
        return OfferDecision.rejected(rejected);
    }

    private void supersede(Offer previous, Instant now) {
        Offer cancelled = update(previous, current -> current.cancel(now));
        notify(cancelled, NotificationType.OFFER_SUPERSEDED, cancelled.getSellerId(), now);
        log.info("Offer superseded by a newer offer: offerId={}", cancelled.getId());
    }

    private Offer update(Offer offer, UnaryOperator<Offer> mutator) {
        try {
            return offerStore.update(offer.getId(), offer.getVersion(), mutator);
        } catch (VersionConflictException e) {
            metrics.recordVersionConflict("Offer");
            log.warn("Version conflict on offer {}: {}", offer.getId(), e.getMessage());
            throw e;
        }
    }

    private void notify(Offer offer, NotificationType type, UUID recipient, Instant now) {
        outboxService.saveNotification(NotificationEvent.create(
                type,
                NotificationEvent.OFFER,
                offer.getId(),
                recipient,
                Map.of(
                        "itemId", offer.getItemId().toString(),
                        "status", offer.getStatus().name(),
                        "amount", offer.getAmount().toPlainString(),
                        "currency", offer.getCurrency().name()),
                now));
    }

    private static BigDecimal normalizeAmount(BigDecimal amount, CurrencyCode currency) {
        try {
            return currency.normalize(amount);
        } catch (ArithmeticException e) {
            throw MarketplaceException.invalidAmount(
                    String.format("Amount %s has more than %d decimals for %s",
                            amount.toPlainString(), currency.getFractionDigits(), currency));
        }
    }

    private <T> T withOfferContext(UUID offerId, Supplier<T> work) {
        MDC.put(CorrelationContext.OFFER_ID_MDC_KEY, offerId.toString());
        try {
            return work.get();
        } finally {
            MDC.remove(CorrelationContext.OFFER_ID_MDC_KEY);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
