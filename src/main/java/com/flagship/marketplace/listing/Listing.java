package com.flagship.marketplace.listing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of a marketplace listing, as returned by the listing service.
 */
@Value
@Builder
public class Listing {
    UUID itemId;
    UUID sellerId;
    BigDecimal price;
    CurrencyCode currency;
    DeliveryMethod deliveryMethod;
    boolean available;
}
