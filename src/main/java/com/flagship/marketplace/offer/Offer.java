package com.flagship.marketplace.offer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.listing.CurrencyCode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A buyer's proposed price for a listing.
 *
 * Immutable: every transition returns a new instance and only a PENDING
 * offer can transition. Offers are never deleted.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Offer {
    UUID id;
    UUID itemId;
    UUID buyerId;
    UUID sellerId;
    BigDecimal amount;
    CurrencyCode currency;
    OfferStatus status;
    String note;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;
    long version;

    /**
     * Creates a new PENDING offer. Amount and parties are validated by the caller.
     */
    public static Offer create(UUID itemId, UUID buyerId, UUID sellerId, BigDecimal amount,
                               CurrencyCode currency, String note, Instant expiresAt, Instant now) {
        return Offer.builder()
                .id(UUID.randomUUID())
                .itemId(itemId)
                .buyerId(buyerId)
                .sellerId(sellerId)
                .amount(amount)
                .currency(currency)
                .status(OfferStatus.PENDING)
                .note(note)
                .expiresAt(expiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Offer accept(Instant now) {
        requirePending("accept");
        if (isExpiredAt(now)) {
            throw MarketplaceException.invalidState(
                    String.format("Offer %s has expired at %s and can no longer be accepted", id, expiresAt));
        }
        return withStatus(OfferStatus.ACCEPTED, now);
    }

    public Offer reject(Instant now) {
        requirePending("reject");
        return withStatus(OfferStatus.REJECTED, now);
    }

    public Offer cancel(Instant now) {
        requirePending("cancel");
        return withStatus(OfferStatus.CANCELLED, now);
    }

    /**
     * @throws MarketplaceException INVALID_STATE if the offer is not pending or its expiry has not passed
     */
    public Offer expire(Instant now) {
        requirePending("expire");
        if (!isExpiredAt(now)) {
            throw MarketplaceException.invalidState(
                    String.format("Offer %s does not expire before %s", id, now));
        }
        return withStatus(OfferStatus.EXPIRED, now);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == OfferStatus.PENDING;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requirePending(String action) {
        if (status != OfferStatus.PENDING) {
            throw MarketplaceException.invalidState(
                    String.format("Cannot %s offer %s: offer is already %s", action, id, status));
        }
    }

    private Offer withStatus(OfferStatus newStatus, Instant now) {
        return toBuilder().status(newStatus).updatedAt(now).build();
    }
}
