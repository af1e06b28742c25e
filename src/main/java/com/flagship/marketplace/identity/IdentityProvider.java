package com.flagship.marketplace.identity;

/**
 * Resolves the authenticated caller of the current request.
 */
public interface IdentityProvider {

    /**
     * @return the caller
     * @throws com.flagship.marketplace.error.MarketplaceException NOT_AUTHORIZED when no valid identity is present
     */
    Actor currentUser();
}
