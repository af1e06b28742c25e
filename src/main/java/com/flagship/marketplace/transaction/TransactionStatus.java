package com.flagship.marketplace.transaction;

/**
 * Transaction status.
 *
 * Under normal progression the status follows from payment and delivery
 * status (see {@link #progressionOf}). CANCELLED, REFUNDED and DISPUTED are
 * entered only through explicit exceptional transitions.
 */
public enum TransactionStatus {
    PENDING,
    PAID,
    /** Ready for pickup or in transit. */
    SHIPPED,
    DELIVERED,
    COMPLETED,
    CANCELLED,
    REFUNDED,
    DISPUTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REFUNDED;
    }

    /**
     * Status implied by payment and delivery progress.
     */
    public static TransactionStatus progressionOf(PaymentStatus paymentStatus, DeliveryStatus deliveryStatus) {
        if (paymentStatus != PaymentStatus.PAID) {
            return PENDING;
        }
        return switch (deliveryStatus) {
            case PENDING, FAILED -> PAID;
            case READY_FOR_PICKUP, IN_TRANSIT -> SHIPPED;
            case DELIVERED -> DELIVERED;
        };
    }
}
