package com.flagship.marketplace.offer;

import com.flagship.marketplace.transaction.Transaction;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a seller's response: the updated offer and, when accepted, the new transaction.
 */
@Value
public class OfferDecision {
    Offer offer;
    Transaction transaction;

    public static OfferDecision rejected(Offer offer) {
        return new OfferDecision(offer, null);
    }

    public static OfferDecision accepted(Offer offer, Transaction transaction) {
        return new OfferDecision(offer, transaction);
    }

    public Optional<Transaction> transaction() {
        return Optional.ofNullable(transaction);
    }
}
