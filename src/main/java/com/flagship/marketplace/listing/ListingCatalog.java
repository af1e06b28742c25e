package com.flagship.marketplace.listing;

import java.util.Optional;
import java.util.UUID;

/**
 * Listing lookups consulted when offers and transactions are created.
 */
public interface ListingCatalog {

    /**
     * @return the listing, or empty when the item does not exist
     * @throws com.flagship.marketplace.error.MarketplaceException UNAVAILABLE when the listing service cannot be reached
     */
    Optional<Listing> get(UUID itemId);
}
