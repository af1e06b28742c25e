package com.flagship.marketplace.evidence;

public enum EvidenceKind {
    /** Proof of payment, added by the buyer. */
    RECEIPT,
    /** Proof of hand-over, added by the seller. */
    DELIVERY_PROOF
}
