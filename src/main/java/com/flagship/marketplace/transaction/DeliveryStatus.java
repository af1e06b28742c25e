package com.flagship.marketplace.transaction;

public enum DeliveryStatus {
    PENDING(0),
    READY_FOR_PICKUP(1),
    IN_TRANSIT(1),
    DELIVERED(2),
    FAILED(0);

    private final int progress;

    DeliveryStatus(int progress) {
        this.progress = progress;
    }

    /**
     * Whether moving to {@code target} goes forward. Delivery never regresses.
     */
    public boolean canAdvanceTo(DeliveryStatus target) {
        return target.progress > this.progress;
    }
}
