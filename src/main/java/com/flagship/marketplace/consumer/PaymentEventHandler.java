package com.flagship.marketplace.consumer;

import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.transaction.PaymentStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStateMachine;
import com.flagship.marketplace.transaction.TransactionStatus;
import com.flagship.marketplace.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Applies the payment collaborator's events to transactions as the system actor.
 *
 * Events arrive late or out of order, so each handler first checks that the
 * transaction still awaits the change and otherwise only logs. A rejected
 * transition would mark the surrounding database transaction rollback-only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEventHandler {

    private final TransactionStore transactionStore;
    private final TransactionStateMachine stateMachine;

    /**
     * @return true if the transaction changed
     */
    public boolean onPaymentConfirmed(UUID transactionId) {
        Optional<Transaction> current = awaitingPayment(transactionId, "PaymentConfirmed");
        if (current.isEmpty() || current.get().getPaymentStatus() == PaymentStatus.PAID) {
            return false;
        }
        stateMachine.markPaid(transactionId, Actor.system(), current.get().getVersion());
        return true;
    }

    public boolean onPaymentProcessing(UUID transactionId) {
        Optional<Transaction> current = awaitingPayment(transactionId, "PaymentProcessing");
        if (current.isEmpty() || current.get().getPaymentStatus() == PaymentStatus.PROCESSING) {
            return false;
        }
        stateMachine.recordPaymentProcessing(transactionId, Actor.system());
        return true;
    }

    public boolean onPaymentFailed(UUID transactionId, String reason) {
        Optional<Transaction> current = awaitingPayment(transactionId, "PaymentFailed");
        if (current.isEmpty() || current.get().getPaymentStatus() == PaymentStatus.FAILED) {
            return false;
        }
        stateMachine.recordPaymentFailure(transactionId, Actor.system(), reason);
        return true;
    }

    private Optional<Transaction> awaitingPayment(UUID transactionId, String eventType) {
        Optional<Transaction> transaction = transactionStore.find(transactionId);
        if (transaction.isEmpty()) {
            log.warn("Ignoring {} for unknown transaction {}", eventType, transactionId);
            return Optional.empty();
        }
        Transaction current = transaction.get();
        if (current.getStatus() != TransactionStatus.PENDING) {
            log.info("Ignoring stale {} for transaction {} in {} status", eventType, transactionId, current.getStatus());
            return Optional.empty();
        }
        return transaction;
    }
}
