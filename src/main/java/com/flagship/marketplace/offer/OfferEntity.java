package com.flagship.marketplace.offer;

import com.flagship.marketplace.listing.CurrencyCode;
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
 * JPA entity for offers.
 *
 * No setters: rows change only through {@link #updateFromDomain}, which
 * copies status and timestamps. {@code pendingKey} is "itemId:buyerId"
 * while the offer is PENDING and null otherwise; its unique constraint
 * keeps at most one pending offer per buyer and item even when two
 * requests race.
 */
@Entity
@Table(name = "offers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OfferEntity implements VersionedEntity<Offer> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

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
    private OfferStatus status;

    @Column(length = 1000, updatable = false)
    private String note;

    @Column(name = "pending_key", length = 80)
    private String pendingKey;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    static OfferEntity fromDomain(Offer offer) {
        return new OfferEntity(
            offer.getId(),
            offer.getItemId(),
            offer.getBuyerId(),
            offer.getSellerId(),
            offer.getAmount(),
            offer.getCurrency(),
            offer.getStatus(),
            offer.getNote(),
            pendingKeyOf(offer),
            offer.getExpiresAt(),
            offer.getCreatedAt(),
            offer.getUpdatedAt(),
            VersionedEntityStore.INITIAL_VERSION
        );
    }

    @Override
    public Offer toDomain() {
        return Offer.builder()
                .id(id)
                .itemId(itemId)
                .buyerId(buyerId)
                .sellerId(sellerId)
                .amount(amount.setScale(currency.getFractionDigits()))
                .currency(currency)
                .status(status)
                .note(note)
                .expiresAt(expiresAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version)
                .build();
    }

    @Override
    public void updateFromDomain(Offer offer) {
        this.status = offer.getStatus();
        this.pendingKey = pendingKeyOf(offer);
        this.updatedAt = offer.getUpdatedAt();
    }

    static String pendingKeyOf(Offer offer) {
        return offer.isPending() ? pendingKey(offer.getItemId(), offer.getBuyerId()) : null;
    }

    static String pendingKey(UUID itemId, UUID buyerId) {
        return itemId + ":" + buyerId;
    }
}
