package com.flagship.marketplace.transaction;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.error.VersionConflictException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.listing.ListingCatalog;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.observability.CorrelationContext;
import com.flagship.marketplace.observability.MarketplaceMetrics;
import com.flagship.marketplace.offer.CompetingOfferCanceller;
import com.flagship.marketplace.offer.Offer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Authoritative lifecycle of a transaction.
 *
 * Every operation receives the acting user, checks in order that the
 * transaction exists, that the actor may perform the action, that the input
 * is complete, and finally that the current state allows it. State rules live
 * in {@link Transaction}; this class owns the role checks and the unit of work.
 *
 * An accepted transition is written with a version-checked update, together
 * with a system message and one notification per other party, in a single
 * database transaction. {@code expectedVersion} is optional: when given it
 * must match the stored version; when null the version read at the start of
 * the call is used, so a concurrent writer still causes a conflict.
 */
@Service
@Slf4j
public class TransactionStateMachine {

    // widths of the marketplace_transactions columns
    static final int MAX_ADDRESS_LENGTH = 500;
    static final int MAX_TRACKING_NUMBER_LENGTH = 100;
    static final int MAX_CANCELLATION_REASON_LENGTH = 1000;

    private final TransactionStore transactionStore;
    private final TransitionJournal journal;
    private final ListingCatalog listingCatalog;
    private final CompetingOfferCanceller competingOfferCanceller;
    private final MarketplaceMetrics metrics;
    private final Clock clock;
    private final int maxTextLength;

    public TransactionStateMachine(TransactionStore transactionStore,
                                   TransitionJournal journal,
                                   ListingCatalog listingCatalog,
                                   CompetingOfferCanceller competingOfferCanceller,
                                   MarketplaceMetrics metrics,
                                   Clock clock,
                                   @Value("${marketplace.messages.max-length:2000}") int maxTextLength) {
        this.transactionStore = transactionStore;
        this.journal = journal;
        this.listingCatalog = listingCatalog;
        this.competingOfferCanceller = competingOfferCanceller;
        this.metrics = metrics;
        this.clock = clock;
        this.maxTextLength = maxTextLength;
    }

    /**
     * Builds the transaction for an accepted offer. Must run in the unit of
     * work that marks the offer accepted.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction createFromOffer(Offer offer, Listing listing, Actor actor) {
        requireItemNotSold(offer.getItemId());
        Instant now = now();

        Transaction created = transactionStore.create(Transaction.open(
                offer.getId(),
                offer.getItemId(),
                offer.getBuyerId(),
                offer.getSellerId(),
                offer.getAmount(),
                offer.getCurrency(),
                listing.getDeliveryMethod(),
                null,
                now));

        journal.record(created, actor, NotificationType.TRANSACTION_CREATED,
                "Offer accepted. Transaction created. Awaiting payment confirmation.", now);

        log.info("Transaction created from offer: transactionId={}, offerId={}, amount={} {}",
                created.getId(), offer.getId(), created.getAmount(), created.getCurrency());
        return created;
    }

    /**
     * Buys an item directly at its listed price.
     */
    @Transactional
    public Transaction purchase(UUID itemId, Actor buyer, String deliveryAddress) {
        return metrics.record("transaction.purchase", () -> {
            Listing listing = listingCatalog.get(itemId)
                    .orElseThrow(() -> MarketplaceException.notFound("Listing", itemId));
            if (!listing.isAvailable()) {
                throw MarketplaceException.invalidState(
                        String.format("Listing %s is not available for purchase", itemId));
            }
            if (buyer.is(listing.getSellerId())) {
                throw MarketplaceException.selfDealing(buyer.getId());
            }
            String address = normalizeText(deliveryAddress);
            if (listing.getDeliveryMethod() == DeliveryMethod.DELIVERY) {
                requireText(address, "Delivery address", MAX_ADDRESS_LENGTH);
            }
            BigDecimal price = normalizePrice(listing);
            requireItemNotSold(itemId);

            Instant now = now();
            Transaction created = transactionStore.create(Transaction.open(
                    null,
                    itemId,
                    buyer.getId(),
                    listing.getSellerId(),
                    price,
                    listing.getCurrency(),
                    listing.getDeliveryMethod(),
                    listing.getDeliveryMethod() == DeliveryMethod.DELIVERY ? address : null,
                    now));

            return withTransactionContext(created.getId(), () -> {
                journal.record(created, buyer, NotificationType.TRANSACTION_CREATED,
                        "Transaction created. Awaiting payment confirmation.", now);
                competingOfferCanceller.cancelPendingOffers(itemId, null, created.getId(), now);

                log.info("Item purchased: itemId={}, buyer={}, amount={} {}",
                        itemId, buyer.getId(), created.getAmount(), created.getCurrency());
                return created;
            });
        });
    }

    /**
     * Records full payment, by the buyer or the payment collaborator.
     */
    @Transactional
    public Transaction markPaid(UUID transactionId, Actor actor, Long expectedVersion) {
        return transition("transaction.mark_paid", transactionId, expectedVersion, actor,
                current -> requireBuyerOrSystem(current, actor, "mark as paid"),
                (tx, now) -> tx.markPaid(now),
                NotificationType.PAYMENT_UPDATED,
                updated -> "Payment confirmed.");
    }

    @Transactional
    public Transaction recordPaymentProcessing(UUID transactionId, Actor actor) {
        return transition("transaction.payment_processing", transactionId, null, actor,
                current -> requireSystem(actor, current, "record payment processing"),
                (tx, now) -> tx.markPaymentProcessing(now),
                NotificationType.PAYMENT_UPDATED,
                updated -> "Payment is being processed.");
    }

    @Transactional
    public Transaction recordPaymentFailure(UUID transactionId, Actor actor, String reason) {
        String text = normalizeText(reason);
        return transition("transaction.payment_failed", transactionId, null, actor,
                current -> requireSystem(actor, current, "record payment failure"),
                (tx, now) -> tx.markPaymentFailed(now),
                NotificationType.PAYMENT_UPDATED,
                updated -> text == null ? "Payment failed." : "Payment failed: " + truncate(text));
    }

    /**
     * Seller moves delivery forward: READY_FOR_PICKUP or IN_TRANSIT mean
     * SHIPPED, DELIVERED means DELIVERED.
     */
    @Transactional
    public Transaction setDeliveryStatus(UUID transactionId, Actor actor, DeliveryStatus target, Long expectedVersion) {
        return transition("transaction.delivery_status", transactionId, expectedVersion, actor,
                current -> {
                    requireSeller(current, actor, "update delivery status of");
                    if (target == null) {
                        throw MarketplaceException.validation("Delivery status is required");
                    }
                },
                (tx, now) -> tx.advanceDelivery(target, now),
                NotificationType.DELIVERY_UPDATED,
                updated -> describeDelivery(target));
    }

    @Transactional
    public Transaction setDeliveryAddress(UUID transactionId, Actor actor, String address, Long expectedVersion) {
        String text = normalizeText(address);
        return transition("transaction.delivery_address", transactionId, expectedVersion, actor,
                current -> {
                    requireBuyer(current, actor, "set the delivery address of");
                    requireText(text, "Delivery address", MAX_ADDRESS_LENGTH);
                },
                (tx, now) -> tx.withDeliveryAddress(text, now),
                NotificationType.DELIVERY_UPDATED,
                updated -> "Delivery address updated.");
    }

    @Transactional
    public Transaction setTrackingNumber(UUID transactionId, Actor actor, String trackingNumber, Long expectedVersion) {
        String text = normalizeText(trackingNumber);
        return transition("transaction.tracking_number", transactionId, expectedVersion, actor,
                current -> {
                    requireSeller(current, actor, "set the tracking number of");
                    requireText(text, "Tracking number", MAX_TRACKING_NUMBER_LENGTH);
                },
                (tx, now) -> tx.withTrackingNumber(text, now),
                NotificationType.DELIVERY_UPDATED,
                updated -> "Item shipped. Tracking number: " + text);
    }

    /**
     * Completes a delivered transaction. Not idempotent: a second call fails.
     */
    @Transactional
    public Transaction complete(UUID transactionId, Actor actor, Long expectedVersion) {
        return completeAs("transaction.complete", transactionId, actor, expectedVersion, "Transaction completed.");
    }

    private Transaction completeAs(String operation, UUID transactionId, Actor actor, Long expectedVersion,
                                   String summary) {
        return transition(operation, transactionId, expectedVersion, actor,
                current -> requireBuyerOrSystem(current, actor, "complete"),
                (tx, now) -> tx.complete(now),
                NotificationType.TRANSACTION_COMPLETED,
                updated -> summary);
    }

    @Transactional
    public Transaction cancel(UUID transactionId, Actor actor, String reason, Long expectedVersion) {
        String text = normalizeText(reason);
        return transition("transaction.cancel", transactionId, expectedVersion, actor,
                current -> {
                    if (!actor.isAdministrator()) {
                        requireParty(current, actor, "cancel");
                    }
                    requireText(text, "Cancellation reason", MAX_CANCELLATION_REASON_LENGTH);
                },
                (tx, now) -> tx.cancel(text, actor.isAdministrator(), now),
                NotificationType.TRANSACTION_CANCELLED,
                updated -> String.format("Transaction cancelled by the %s. Cancellation reason: %s",
                        roleLabel(updated, actor), text));
    }

    /**
     * Opens a dispute. Payment and delivery status are left as they are.
     */
    @Transactional
    public Transaction reportProblem(UUID transactionId, Actor actor, String description, Long expectedVersion) {
        String text = normalizeText(description);
        return transition("transaction.report_problem", transactionId, expectedVersion, actor,
                current -> {
                    requireParty(current, actor, "report a problem on");
                    requireText(text, "Problem description", maxTextLength);
                },
                (tx, now) -> tx.openDispute(now),
                NotificationType.PROBLEM_REPORTED,
                updated -> String.format("A problem has been reported by the %s: %s",
                        roleLabel(updated, actor), text));
    }

    @Transactional
    public Transaction refund(UUID transactionId, Actor actor, Long expectedVersion) {
        return transition("transaction.refund", transactionId, expectedVersion, actor,
                current -> requireAdministrator(actor, current, "refund"),
                (tx, now) -> tx.refund(now),
                NotificationType.TRANSACTION_REFUNDED,
                updated -> "Transaction refunded by an administrator.");
    }

    @Transactional
    public Transaction resolveDispute(UUID transactionId, Actor actor, DisputeOutcome outcome, Long expectedVersion) {
        if (outcome == DisputeOutcome.REFUND) {
            return refund(transactionId, actor, expectedVersion);
        }
        return transition("transaction.resolve_dispute", transactionId, expectedVersion, actor,
                current -> {
                    requireAdministrator(actor, current, "resolve a dispute on");
                    if (outcome == null) {
                        throw MarketplaceException.validation("Dispute outcome is required");
                    }
                },
                (tx, now) -> tx.releaseFromDispute(now),
                NotificationType.DISPUTE_RESOLVED,
                updated -> "Dispute resolved by an administrator. Funds released to the seller.");
    }

    /**
     * Completes a single delivered transaction on behalf of the system if its
     * delivery happened before {@code cutoff}. Returns false when the
     * transaction has moved on since it was selected.
     */
    @Transactional
    public boolean autoComplete(UUID transactionId, Instant cutoff) {
        Transaction current = transactionStore.get(transactionId);
        if (current.getStatus() != TransactionStatus.DELIVERED
                || current.getDeliveredAt() == null
                || current.getDeliveredAt().isAfter(cutoff)) {
            return false;
        }
        completeAs("transaction.auto_complete", transactionId, Actor.system(), current.getVersion(),
                "Transaction automatically completed.");
        return true;
    }

    @Transactional(readOnly = true)
    public Transaction get(UUID transactionId, Actor actor) {
        Transaction transaction = transactionStore.get(transactionId);
        if (!actor.isAdministrator() && !actor.isSystem() && transaction.partyOf(actor.getId()).isEmpty()) {
            throw MarketplaceException.notAuthorized(
                    String.format("User %s is not a party to transaction %s", actor.getId(), transactionId));
        }
        return transaction;
    }

    @Transactional(readOnly = true)
    public List<Transaction> listForUser(Actor actor) {
        return transactionStore.findByParticipant(actor.getId());
    }

    private Transaction transition(String operation,
                                   UUID transactionId,
                                   Long expectedVersion,
                                   Actor actor,
                                   Consumer<Transaction> authorize,
                                   BiFunction<Transaction, Instant, Transaction> change,
                                   NotificationType notificationType,
                                   Function<Transaction, String> summary) {
        return metrics.record(operation, () -> withTransactionContext(transactionId, () -> {
            Transaction current = transactionStore.get(transactionId);
            authorize.accept(current);

            long version = expectedVersion != null ? expectedVersion : current.getVersion();
            Instant now = now();
            Transaction updated = update(transactionId, version, tx -> change.apply(tx, now));

            String text = summary.apply(updated);
            journal.record(updated, actor, notificationType, text, now);

            log.info("Transaction transition accepted: operation={}, status {} -> {}, version={}, actor={}",
                    operation, current.getStatus(), updated.getStatus(), updated.getVersion(), actor.getRole());
            return updated;
        }));
    }

    private Transaction update(UUID transactionId, long expectedVersion, UnaryOperator<Transaction> mutator) {
        try {
            return transactionStore.update(transactionId, expectedVersion, mutator);
        } catch (VersionConflictException e) {
            metrics.recordVersionConflict("Transaction");
            log.warn("Version conflict on transaction {}: {}", transactionId, e.getMessage());
            throw e;
        }
    }

    private <T> T withTransactionContext(UUID transactionId, Supplier<T> work) {
        String previous = MDC.get(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            return work.get();
        } finally {
            if (previous != null) {
                MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, previous);
            } else {
                MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            }
        }
    }

    private void requireItemNotSold(UUID itemId) {
        transactionStore.findOpenForItem(itemId).ifPresent(open -> {
            throw MarketplaceException.invalidState(
                    String.format("Item %s already sold in transaction %s", itemId, open.getId()));
        });
    }

    private BigDecimal normalizePrice(Listing listing) {
        CurrencyCode currency = listing.getCurrency();
        BigDecimal price = listing.getPrice();
        if (price == null || price.signum() <= 0) {
            throw MarketplaceException.invalidAmount(
                    String.format("Listing %s has no positive price", listing.getItemId()));
        }
        try {
            return currency.normalize(price);
        } catch (ArithmeticException e) {
            throw MarketplaceException.invalidAmount(
                    String.format("Price %s has more than %d decimals for %s",
                            price.toPlainString(), currency.getFractionDigits(), currency));
        }
    }

    private void requireParty(Transaction transaction, Actor actor, String action) {
        if (transaction.partyOf(actor.getId()).isEmpty()) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only the buyer or seller can %s transaction %s", action, transaction.getId()));
        }
    }

    private void requireBuyer(Transaction transaction, Actor actor, String action) {
        if (!actor.is(transaction.getBuyerId())) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only the buyer can %s transaction %s", action, transaction.getId()));
        }
    }

    private void requireSeller(Transaction transaction, Actor actor, String action) {
        if (!actor.is(transaction.getSellerId())) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only the seller can %s transaction %s", action, transaction.getId()));
        }
    }

    private void requireBuyerOrSystem(Transaction transaction, Actor actor, String action) {
        if (!actor.isSystem() && !actor.is(transaction.getBuyerId())) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only the buyer or the payment system can %s transaction %s",
                            action, transaction.getId()));
        }
    }

    private void requireSystem(Actor actor, Transaction transaction, String action) {
        if (!actor.isSystem()) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only the payment system can %s on transaction %s", action, transaction.getId()));
        }
    }

    private void requireAdministrator(Actor actor, Transaction transaction, String action) {
        if (!actor.isAdministrator()) {
            throw MarketplaceException.notAuthorized(
                    String.format("Only an administrator can %s transaction %s", action, transaction.getId()));
        }
    }

    private static void requireText(String text, String field, int maxLength) {
        if (text == null) {
            throw MarketplaceException.validation(field + " is required");
        }
        if (text.length() > maxLength) {
            throw MarketplaceException.validation(
                    String.format("%s exceeds %d characters", field, maxLength));
        }
    }

    private String roleLabel(Transaction transaction, Actor actor) {
        if (actor.isAdministrator() && transaction.partyOf(actor.getId()).isEmpty()) {
            return "administrator";
        }
        return transaction.partyOf(actor.getId()).map(Party::label).orElse("system");
    }

    private static String describeDelivery(DeliveryStatus target) {
        return switch (target) {
            case READY_FOR_PICKUP -> "Item is ready for pickup.";
            case IN_TRANSIT -> "Item is in transit.";
            case DELIVERED -> "Item delivered.";
            case PENDING, FAILED -> "Delivery status updated.";
        };
    }

    private String truncate(String text) {
        return text.length() > maxTextLength ? text.substring(0, maxTextLength) : text;
    }

    private static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.strip();
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
