package com.flagship.marketplace.transaction;

import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.listing.CurrencyCode;
import com.flagship.marketplace.listing.DeliveryMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private Transaction open(DeliveryMethod method) {
        return Transaction.open(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                new BigDecimal("40.00"), CurrencyCode.USD, method, null, T0);
    }

    private Transaction paid(DeliveryMethod method) {
        return open(method).markPaid(T0.plusSeconds(60));
    }

    private Transaction delivered() {
        return paid(DeliveryMethod.PICKUP).advanceDelivery(DeliveryStatus.DELIVERED, T0.plusSeconds(120));
    }

    private static void assertKind(ErrorKind expected, Executable executable) {
        MarketplaceException e = assertThrows(MarketplaceException.class, executable);
        assertEquals(expected, e.getKind(), e.getMessage());
    }

    @Test
    @DisplayName("A new transaction is PENDING with payment and delivery pending")
    void open_startsPending() {
        Transaction tx = open(DeliveryMethod.PICKUP);

        assertEquals(TransactionStatus.PENDING, tx.getStatus());
        assertEquals(PaymentStatus.PENDING, tx.getPaymentStatus());
        assertEquals(DeliveryStatus.PENDING, tx.getDeliveryStatus());
        assertNull(tx.getCompletedAt());
        assertTrue(tx.holdsItem());
    }

    @Nested
    @DisplayName("Payment")
    class Payment {

        @Test
        @DisplayName("markPaid moves PENDING to PAID")
        void markPaid() {
            Transaction tx = paid(DeliveryMethod.PICKUP);

            assertEquals(TransactionStatus.PAID, tx.getStatus());
            assertEquals(PaymentStatus.PAID, tx.getPaymentStatus());
        }

        @Test
        @DisplayName("markPaid twice is rejected")
        void markPaidTwice() {
            Transaction tx = paid(DeliveryMethod.PICKUP);

            MarketplaceException e = assertThrows(MarketplaceException.class, () -> tx.markPaid(T0));
            assertEquals(ErrorKind.INVALID_STATE, e.getKind());
            assertTrue(e.getMessage().contains("already paid"));
        }

        @Test
        @DisplayName("Processing and failure keep the transaction PENDING and can be followed by payment")
        void processingThenFailureThenPaid() {
            Transaction processing = open(DeliveryMethod.PICKUP).markPaymentProcessing(T0);
            assertEquals(PaymentStatus.PROCESSING, processing.getPaymentStatus());
            assertEquals(TransactionStatus.PENDING, processing.getStatus());

            Transaction failed = processing.markPaymentFailed(T0);
            assertEquals(PaymentStatus.FAILED, failed.getPaymentStatus());
            assertEquals(TransactionStatus.PENDING, failed.getStatus());

            Transaction paid = failed.markPaid(T0);
            assertEquals(TransactionStatus.PAID, paid.getStatus());
        }

        @Test
        @DisplayName("Payment processing cannot be recorded after payment")
        void processingAfterPaid() {
            Transaction tx = paid(DeliveryMethod.PICKUP);

            assertKind(ErrorKind.INVALID_STATE, () -> tx.markPaymentProcessing(T0));
        }
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @ParameterizedTest
        @EnumSource(value = DeliveryStatus.class, names = {"READY_FOR_PICKUP", "IN_TRANSIT"})
        @DisplayName("Ready for pickup and in transit both mean SHIPPED")
        void shippedStatuses(DeliveryStatus target) {
            Transaction tx = paid(DeliveryMethod.DELIVERY).advanceDelivery(target, T0);

            assertEquals(TransactionStatus.SHIPPED, tx.getStatus());
            assertEquals(target, tx.getDeliveryStatus());
            assertNull(tx.getDeliveredAt());
        }

        @Test
        @DisplayName("Delivered stamps deliveredAt")
        void delivered_setsTimestamp() {
            Transaction tx = delivered();

            assertEquals(TransactionStatus.DELIVERED, tx.getStatus());
            assertEquals(T0.plusSeconds(120), tx.getDeliveredAt());
        }

        @Test
        @DisplayName("Delivery cannot progress before payment")
        void deliveryBeforePayment() {
            Transaction tx = open(DeliveryMethod.PICKUP);

            MarketplaceException e = assertThrows(MarketplaceException.class,
                    () -> tx.advanceDelivery(DeliveryStatus.DELIVERED, T0));
            assertEquals(ErrorKind.INVALID_STATE, e.getKind());
            assertTrue(e.getMessage().contains("PENDING status"));
        }

        @Test
        @DisplayName("Delivery never regresses")
        void deliveryNeverRegresses() {
            Transaction inTransit = paid(DeliveryMethod.DELIVERY).advanceDelivery(DeliveryStatus.IN_TRANSIT, T0);

            assertKind(ErrorKind.INVALID_STATE, () -> inTransit.advanceDelivery(DeliveryStatus.READY_FOR_PICKUP, T0));
            assertKind(ErrorKind.INVALID_STATE, () -> inTransit.advanceDelivery(DeliveryStatus.IN_TRANSIT, T0));
        }

        @ParameterizedTest
        @EnumSource(value = DeliveryStatus.class, names = {"PENDING", "FAILED"})
        @DisplayName("PENDING and FAILED cannot be requested")
        void unsupportedTargets(DeliveryStatus target) {
            Transaction tx = paid(DeliveryMethod.PICKUP);

            assertKind(ErrorKind.VALIDATION_ERROR, () -> tx.advanceDelivery(target, T0));
        }

        @Test
        @DisplayName("A tracking number puts a paid delivery in transit")
        void trackingNumber() {
            Transaction tx = paid(DeliveryMethod.DELIVERY).withTrackingNumber("1Z999", T0);

            assertEquals("1Z999", tx.getDeliveryTrackingNumber());
            assertEquals(DeliveryStatus.IN_TRANSIT, tx.getDeliveryStatus());
            assertEquals(TransactionStatus.SHIPPED, tx.getStatus());
        }

        @Test
        @DisplayName("Address and tracking number require the DELIVERY method")
        void pickupHasNoAddress() {
            Transaction pending = open(DeliveryMethod.PICKUP);
            Transaction paid = paid(DeliveryMethod.PICKUP);

            assertKind(ErrorKind.VALIDATION_ERROR, () -> pending.withDeliveryAddress("Main St 1", T0));
            assertKind(ErrorKind.VALIDATION_ERROR, () -> paid.withTrackingNumber("1Z999", T0));
        }

        @Test
        @DisplayName("The delivery address is fixed once shipped")
        void addressAfterShipping() {
            Transaction shipped = paid(DeliveryMethod.DELIVERY).advanceDelivery(DeliveryStatus.IN_TRANSIT, T0);

            assertKind(ErrorKind.INVALID_STATE, () -> shipped.withDeliveryAddress("Main St 1", T0));
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        @DisplayName("complete sets completedAt once and a second call fails")
        void completeOnce() {
            Instant completedAt = T0.plusSeconds(600);
            Transaction completed = delivered().complete(completedAt);

            assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
            assertEquals(completedAt, completed.getCompletedAt());
            assertTrue(completed.isTerminal());

            MarketplaceException e = assertThrows(MarketplaceException.class,
                    () -> completed.complete(completedAt.plusSeconds(1)));
            assertEquals(ErrorKind.INVALID_STATE, e.getKind());
            assertTrue(e.getMessage().contains("already COMPLETED"));
        }

        @Test
        @DisplayName("Only delivered transactions can be completed")
        void completeBeforeDelivery() {
            assertKind(ErrorKind.INVALID_STATE, () -> paid(DeliveryMethod.PICKUP).complete(T0));
        }
    }

    @Nested
    @DisplayName("Cancellation and disputes")
    class Exceptional {

        @Test
        @DisplayName("Cancellation records the reason and releases the item")
        void cancel() {
            Transaction tx = paid(DeliveryMethod.PICKUP).cancel("Changed my mind", false, T0);

            assertEquals(TransactionStatus.CANCELLED, tx.getStatus());
            assertEquals("Changed my mind", tx.getCancellationReason());
            assertFalse(tx.holdsItem());
        }

        @Test
        @DisplayName("Only an administrator can cancel a dispute")
        void cancelDisputed() {
            Transaction disputed = delivered().openDispute(T0);

            assertKind(ErrorKind.INVALID_STATE, () -> disputed.cancel("no", false, T0));
            assertEquals(TransactionStatus.CANCELLED, disputed.cancel("fraud", true, T0).getStatus());
        }

        @Test
        @DisplayName("A dispute keeps payment and delivery status")
        void disputeKeepsSubStatus() {
            Transaction disputed = delivered().openDispute(T0);

            assertEquals(TransactionStatus.DISPUTED, disputed.getStatus());
            assertEquals(PaymentStatus.PAID, disputed.getPaymentStatus());
            assertEquals(DeliveryStatus.DELIVERED, disputed.getDeliveryStatus());
            assertKind(ErrorKind.INVALID_STATE, () -> disputed.openDispute(T0));
        }

        @Test
        @DisplayName("A pending transaction cannot be disputed")
        void disputePending() {
            assertKind(ErrorKind.INVALID_STATE, () -> open(DeliveryMethod.PICKUP).openDispute(T0));
        }

        @Test
        @DisplayName("Refund and release resolve a dispute")
        void resolve() {
            Transaction disputed = paid(DeliveryMethod.PICKUP).openDispute(T0);

            Transaction refunded = disputed.refund(T0);
            assertEquals(TransactionStatus.REFUNDED, refunded.getStatus());
            assertEquals(PaymentStatus.REFUNDED, refunded.getPaymentStatus());
            assertFalse(refunded.holdsItem());

            Transaction released = disputed.releaseFromDispute(T0);
            assertEquals(TransactionStatus.COMPLETED, released.getStatus());
            assertEquals(T0, released.getCompletedAt());
        }

        @Test
        @DisplayName("Refund requires a dispute")
        void refundWithoutDispute() {
            assertKind(ErrorKind.INVALID_STATE, () -> delivered().refund(T0));
        }

        @ParameterizedTest
        @EnumSource(value = TransactionStatus.class, names = {"COMPLETED", "CANCELLED", "REFUNDED"})
        @DisplayName("Terminal statuses accept no transition")
        void terminal(TransactionStatus status) {
            Transaction tx = open(DeliveryMethod.DELIVERY).toBuilder().status(status).build();

            for (TransactionStatus target : TransactionStatus.values()) {
                assertFalse(tx.canTransitionTo(target));
            }
            assertKind(ErrorKind.INVALID_STATE, () -> tx.cancel("late", true, T0));
            assertKind(ErrorKind.INVALID_STATE, () -> tx.markPaid(T0));
        }
    }
}
