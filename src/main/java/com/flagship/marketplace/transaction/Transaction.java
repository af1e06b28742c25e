package com.flagship.marketplace.transaction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.DeliveryMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A bound sale between a buyer and a seller.
 *
 * Immutable domain object holding the transition rules. Each transition
 * validates the current state and returns a new instance; role checks
 * belong to {@link TransactionStateMachine}. Amount, parties and delivery
 * method never change after creation.
 *
 * Normal progression (status derived from payment and delivery status):
 * <pre>
 * PENDING -> PAID -> SHIPPED -> DELIVERED -> COMPLETED
 * </pre>
 * Exceptional transitions: any non-terminal -> CANCELLED,
 * PAID/SHIPPED/DELIVERED -> DISPUTED, DISPUTED -> REFUNDED or COMPLETED.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {

    private static final Set<TransactionStatus> DISPUTABLE =
            EnumSet.of(TransactionStatus.PAID, TransactionStatus.SHIPPED, TransactionStatus.DELIVERED);

    UUID id;
    UUID offerId;
    UUID itemId;
    UUID buyerId;
    UUID sellerId;
    BigDecimal amount;
    CurrencyCode currency;
    TransactionStatus status;
    PaymentStatus paymentStatus;
    DeliveryMethod deliveryMethod;
    DeliveryStatus deliveryStatus;
    String deliveryAddress;
    String deliveryTrackingNumber;
    String cancellationReason;
    Instant deliveredAt;
    Instant completedAt;
    Instant createdAt;
    Instant updatedAt;
    long version;

    /**
     * Creates a PENDING transaction with payment and delivery pending.
     *
     * @param offerId originating offer, null for a direct purchase
     */
    public static Transaction open(UUID offerId, UUID itemId, UUID buyerId, UUID sellerId,
                                   BigDecimal amount, CurrencyCode currency,
                                   DeliveryMethod deliveryMethod, String deliveryAddress, Instant now) {
        return Transaction.builder()
                .id(UUID.randomUUID())
                .offerId(offerId)
                .itemId(itemId)
                .buyerId(buyerId)
                .sellerId(sellerId)
                .amount(amount)
                .currency(currency)
                .status(TransactionStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .deliveryMethod(deliveryMethod)
                .deliveryStatus(DeliveryStatus.PENDING)
                .deliveryAddress(deliveryAddress)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Optional<Party> partyOf(UUID userId) {
        if (buyerId.equals(userId)) {
            return Optional.of(Party.BUYER);
        }
        if (sellerId.equals(userId)) {
            return Optional.of(Party.SELLER);
        }
        return Optional.empty();
    }

    public UUID counterpartyOf(Party party) {
        return party == Party.BUYER ? sellerId : buyerId;
    }

    /**
     * Records full payment. Only valid while PENDING and not yet paid.
     */
    public Transaction markPaid(Instant now) {
        requireNotTerminal("mark as paid");
        if (paymentStatus == PaymentStatus.PAID) {
            throw MarketplaceException.invalidState(
                String.format("Transaction %s is already paid", id));
        }
        requireTransition(TransactionStatus.PAID, "mark as paid");
        return toBuilder()
                .paymentStatus(PaymentStatus.PAID)
                .status(TransactionStatus.progressionOf(PaymentStatus.PAID, deliveryStatus))
                .updatedAt(now)
                .build();
    }

    /**
     * Payment submitted and awaiting confirmation (receipt uploaded or processor working).
     */
    public Transaction markPaymentProcessing(Instant now) {
        requireAwaitingPayment("record payment processing");
        if (paymentStatus == PaymentStatus.PROCESSING) {
            throw MarketplaceException.invalidState(
                String.format("Payment for transaction %s is already processing", id));
        }
        return toBuilder().paymentStatus(PaymentStatus.PROCESSING).updatedAt(now).build();
    }

    public Transaction markPaymentFailed(Instant now) {
        requireAwaitingPayment("record payment failure");
        if (paymentStatus == PaymentStatus.FAILED) {
            throw MarketplaceException.invalidState(
                String.format("Payment for transaction %s has already failed", id));
        }
        return toBuilder().paymentStatus(PaymentStatus.FAILED).updatedAt(now).build();
    }

    /**
     * Moves delivery forward. Status follows: READY_FOR_PICKUP and IN_TRANSIT
     * mean SHIPPED, DELIVERED means DELIVERED.
     */
    public Transaction advanceDelivery(DeliveryStatus target, Instant now) {
        if (target == DeliveryStatus.PENDING || target == DeliveryStatus.FAILED) {
            throw MarketplaceException.validation(
                String.format("Delivery status %s cannot be set; use READY_FOR_PICKUP, IN_TRANSIT or DELIVERED",
                    target));
        }
        requireNotTerminal("update delivery status of");
        if (status != TransactionStatus.PAID && status != TransactionStatus.SHIPPED) {
            throw MarketplaceException.invalidState(
                String.format("Cannot update delivery of transaction %s in %s status. Only PAID or SHIPPED "
                    + "transactions can progress delivery.", id, status));
        }
        if (!deliveryStatus.canAdvanceTo(target)) {
            throw MarketplaceException.invalidState(
                String.format("Delivery of transaction %s cannot move from %s to %s", id, deliveryStatus, target));
        }
        return toBuilder()
                .deliveryStatus(target)
                .status(TransactionStatus.progressionOf(paymentStatus, target))
                .deliveredAt(target == DeliveryStatus.DELIVERED ? now : deliveredAt)
                .updatedAt(now)
                .build();
    }

    public Transaction withDeliveryAddress(String address, Instant now) {
        requireDeliveryMethod("set a delivery address for");
        requireNotTerminal("set the delivery address of");
        if (status != TransactionStatus.PENDING && status != TransactionStatus.PAID) {
            throw MarketplaceException.invalidState(
                String.format("Cannot change the delivery address of transaction %s in %s status. "
                    + "Only PENDING or PAID transactions accept an address.", id, status));
        }
        return toBuilder().deliveryAddress(address).updatedAt(now).build();
    }

    /**
     * Sets the carrier tracking number. If delivery has not started, the item
     * is considered in transit.
     */
    public Transaction withTrackingNumber(String trackingNumber, Instant now) {
        requireDeliveryMethod("set a tracking number for");
        requireNotTerminal("set the tracking number of");
        if (status != TransactionStatus.PAID && status != TransactionStatus.SHIPPED) {
            throw MarketplaceException.invalidState(
                String.format("Cannot set a tracking number on transaction %s in %s status. "
                    + "Only PAID or SHIPPED transactions accept tracking.", id, status));
        }
        DeliveryStatus newDeliveryStatus = deliveryStatus == DeliveryStatus.PENDING
                ? DeliveryStatus.IN_TRANSIT
                : deliveryStatus;
        return toBuilder()
                .deliveryTrackingNumber(trackingNumber)
                .deliveryStatus(newDeliveryStatus)
                .status(TransactionStatus.progressionOf(paymentStatus, newDeliveryStatus))
                .updatedAt(now)
                .build();
    }

    /**
     * Completes a delivered transaction. Sets {@code completedAt} exactly once;
     * a second call fails.
     */
    public Transaction complete(Instant now) {
        requireNotTerminal("complete");
        if (status != TransactionStatus.DELIVERED) {
            throw MarketplaceException.invalidState(
                String.format("Cannot complete transaction %s in %s status. Only DELIVERED transactions "
                    + "can be completed.", id, status));
        }
        return toBuilder()
                .status(TransactionStatus.COMPLETED)
                .completedAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * @param byAdministrator whether the actor may cancel a DISPUTED transaction
     */
    public Transaction cancel(String reason, boolean byAdministrator, Instant now) {
        requireNotTerminal("cancel");
        if (status == TransactionStatus.DISPUTED && !byAdministrator) {
            throw MarketplaceException.invalidState(
                String.format("Transaction %s is DISPUTED; only an administrator can cancel it", id));
        }
        return toBuilder()
                .status(TransactionStatus.CANCELLED)
                .cancellationReason(reason)
                .updatedAt(now)
                .build();
    }

    /**
     * Opens a dispute. Payment and delivery status are left untouched.
     */
    public Transaction openDispute(Instant now) {
        requireNotTerminal("report a problem on");
        if (status == TransactionStatus.DISPUTED) {
            throw MarketplaceException.invalidState(
                String.format("Transaction %s is already DISPUTED", id));
        }
        if (!DISPUTABLE.contains(status)) {
            throw MarketplaceException.invalidState(
                String.format("Cannot report a problem on transaction %s in %s status. Only PAID, SHIPPED or "
                    + "DELIVERED transactions can be disputed.", id, status));
        }
        return toBuilder().status(TransactionStatus.DISPUTED).updatedAt(now).build();
    }

    public Transaction refund(Instant now) {
        requireDisputed("refund");
        return toBuilder()
                .status(TransactionStatus.REFUNDED)
                .paymentStatus(PaymentStatus.REFUNDED)
                .updatedAt(now)
                .build();
    }

    /**
     * Resolves a dispute in the seller's favour.
     */
    public Transaction releaseFromDispute(Instant now) {
        requireDisputed("release");
        return toBuilder()
                .status(TransactionStatus.COMPLETED)
                .completedAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Records a change to a child collection (evidence) so it is ordered
     * against concurrent transitions by the version stamp.
     */
    public Transaction touch(Instant now) {
        return toBuilder().updatedAt(now).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Whether the transaction still holds its item. Cancelled or refunded
     * sales release the item for another buyer.
     */
    public boolean holdsItem() {
        return status != TransactionStatus.CANCELLED && status != TransactionStatus.REFUNDED;
    }

    public boolean canTransitionTo(TransactionStatus targetStatus) {
        return switch (this.status) {
            case PENDING -> targetStatus == TransactionStatus.PAID
                    || targetStatus == TransactionStatus.CANCELLED;
            case PAID -> targetStatus == TransactionStatus.SHIPPED
                    || targetStatus == TransactionStatus.DELIVERED
                    || targetStatus == TransactionStatus.CANCELLED
                    || targetStatus == TransactionStatus.DISPUTED;
            case SHIPPED -> targetStatus == TransactionStatus.DELIVERED
                    || targetStatus == TransactionStatus.CANCELLED
                    || targetStatus == TransactionStatus.DISPUTED;
            case DELIVERED -> targetStatus == TransactionStatus.COMPLETED
                    || targetStatus == TransactionStatus.CANCELLED
                    || targetStatus == TransactionStatus.DISPUTED;
            case DISPUTED -> targetStatus == TransactionStatus.REFUNDED
                    || targetStatus == TransactionStatus.COMPLETED
                    || targetStatus == TransactionStatus.CANCELLED;
            case COMPLETED, CANCELLED, REFUNDED -> false;
        };
    }

    private void requireNotTerminal(String action) {
        if (isTerminal()) {
            throw MarketplaceException.invalidState(
                String.format("Cannot %s transaction %s: transaction is already %s", action, id, status));
        }
    }

    private void requireTransition(TransactionStatus target, String action) {
        if (!canTransitionTo(target)) {
            throw MarketplaceException.invalidState(
                String.format("Cannot %s transaction %s in %s status", action, id, status));
        }
    }

    private void requireAwaitingPayment(String action) {
        requireNotTerminal(action);
        if (status != TransactionStatus.PENDING || paymentStatus == PaymentStatus.PAID) {
            throw MarketplaceException.invalidState(
                String.format("Cannot %s on transaction %s in %s status with payment %s",
                    action, id, status, paymentStatus));
        }
    }

    private void requireDeliveryMethod(String action) {
        if (deliveryMethod != DeliveryMethod.DELIVERY) {
            throw MarketplaceException.validation(
                String.format("Cannot %s transaction %s: delivery method is %s", action, id, deliveryMethod));
        }
    }

    private void requireDisputed(String action) {
        requireNotTerminal(action);
        if (status != TransactionStatus.DISPUTED) {
            throw MarketplaceException.invalidState(
                String.format("Cannot %s transaction %s in %s status. Only DISPUTED transactions can be "
                    + "resolved by an administrator.", action, id, status));
        }
    }
}
