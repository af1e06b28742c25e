package com.flagship.marketplace.messaging;

public enum SenderType {
    BUYER,
    SELLER,
    SYSTEM
}
