package com.flagship.marketplace.offer;

/**
 * Seller's answer to a pending offer.
 */
public enum OfferAction {
    ACCEPT,
    REJECT
}
