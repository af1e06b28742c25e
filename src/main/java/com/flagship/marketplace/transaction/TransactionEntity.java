package com.flagship.marketplace.transaction;

import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.store.VersionedEntity;
import com.flagship.marketplace.store.VersionedEntityStore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for transactions.
 *
 * Key design principles:
 * - No setters: rows change only through {@link #updateFromDomain}
 * - Identity, parties, amount, currency and delivery method are not updatable
 * - {@code offerId} is unique, so an offer yields at most one transaction
 * - {@code openItemId} holds the item id while the sale holds the item
 *   (not cancelled or refunded); its unique constraint stops two open
 *   sales of the same item
 */
@Entity
@Table(name = "marketplace_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity implements VersionedEntity<Transaction> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "offer_id", updatable = false)
    private UUID offerId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private UUID buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_method", nullable = false, updatable = false, length = 20)
    private DeliveryMethod deliveryMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", nullable = false, length = 20)
    private DeliveryStatus deliveryStatus;

    @Column(name = "delivery_address", length = 500)
    private String deliveryAddress;

    @Column(name = "delivery_tracking_number", length = 100)
    private String deliveryTrackingNumber;

    @Column(name = "cancellation_reason", length = 1000)
    private String cancellationReason;

    @Column(name = "open_item_id")
    private UUID openItemId;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getOfferId(),
            transaction.getItemId(),
            transaction.getBuyerId(),
            transaction.getSellerId(),
            transaction.getAmount(),
            transaction.getCurrency(),
            transaction.getStatus(),
            transaction.getPaymentStatus(),
            transaction.getDeliveryMethod(),
            transaction.getDeliveryStatus(),
            transaction.getDeliveryAddress(),
            transaction.getDeliveryTrackingNumber(),
            transaction.getCancellationReason(),
            openItemIdOf(transaction),
            transaction.getDeliveredAt(),
            transaction.getCompletedAt(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt(),
            VersionedEntityStore.INITIAL_VERSION
        );
    }

    @Override
    public Transaction toDomain() {
        return Transaction.builder()
                .id(id)
                .offerId(offerId)
                .itemId(itemId)
                .buyerId(buyerId)
                .sellerId(sellerId)
                .amount(amount.setScale(currency.getFractionDigits()))
                .currency(currency)
                .status(status)
                .paymentStatus(paymentStatus)
                .deliveryMethod(deliveryMethod)
                .deliveryStatus(deliveryStatus)
                .deliveryAddress(deliveryAddress)
                .deliveryTrackingNumber(deliveryTrackingNumber)
                .cancellationReason(cancellationReason)
                .deliveredAt(deliveredAt)
                .completedAt(completedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version)
                .build();
    }

    /**
     * Copies status fields and delivery details. {@code completedAt} is only
     * ever written once.
     */
    @Override
    public void updateFromDomain(Transaction transaction) {
        if (this.completedAt != null && !this.completedAt.equals(transaction.getCompletedAt())) {
            throw new IllegalStateException("completedAt of transaction " + id + " is already set");
        }
        this.status = transaction.getStatus();
        this.paymentStatus = transaction.getPaymentStatus();
        this.deliveryStatus = transaction.getDeliveryStatus();
        this.deliveryAddress = transaction.getDeliveryAddress();
        this.deliveryTrackingNumber = transaction.getDeliveryTrackingNumber();
        this.cancellationReason = transaction.getCancellationReason();
        this.openItemId = openItemIdOf(transaction);
        this.deliveredAt = transaction.getDeliveredAt();
        this.completedAt = transaction.getCompletedAt();
        this.updatedAt = transaction.getUpdatedAt();
    }

    private static UUID openItemIdOf(Transaction transaction) {
        return transaction.holdsItem() ? transaction.getItemId() : null;
    }
}
