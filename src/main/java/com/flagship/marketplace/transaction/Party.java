package com.flagship.marketplace.transaction;

import java.util.Locale;

/**
 * Side of a transaction a user is on.
 */
public enum Party {
    BUYER,
    SELLER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
