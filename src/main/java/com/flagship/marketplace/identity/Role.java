package com.flagship.marketplace.identity;

public enum Role {
    /** Regular user; acts as buyer or seller depending on the entity. */
    MEMBER,
    /** Resolves disputes, issues refunds, may cancel disputed transactions. */
    ADMINISTRATOR,
    /** Internal actor for scheduled jobs and the payment collaborator. */
    SYSTEM
}
