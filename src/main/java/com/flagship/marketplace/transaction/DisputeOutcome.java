package com.flagship.marketplace.transaction;

public enum DisputeOutcome {
    /** Funds go to the seller; the transaction completes. */
    RELEASE,
    /** Funds go back to the buyer. */
    REFUND
}
