package com.flagship.marketplace.offer;

/**
 * Offer lifecycle.
 *
 * PENDING -> ACCEPTED (seller)
 * PENDING -> REJECTED (seller)
 * PENDING -> CANCELLED (buyer, or superseded by a newer offer, or item sold)
 * PENDING -> EXPIRED (expiry sweep)
 */
public enum OfferStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
