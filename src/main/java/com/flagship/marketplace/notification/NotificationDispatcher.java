package com.flagship.marketplace.notification;

/**
 * Fans notification events out to users (push, e-mail, in-app).
 *
 * Called by the outbox publisher after the state change has committed, so a
 * failure here never affects the transition itself.
 */
public interface NotificationDispatcher {

    /**
     * @throws NotificationDeliveryException when the event could not be handed over; it is retried later
     */
    void emit(NotificationEvent event);
}
