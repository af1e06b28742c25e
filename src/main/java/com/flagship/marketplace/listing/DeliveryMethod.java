package com.flagship.marketplace.listing;

public enum DeliveryMethod {
    PICKUP,
    DELIVERY
}
