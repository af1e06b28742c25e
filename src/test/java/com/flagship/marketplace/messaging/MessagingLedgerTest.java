package com.flagship.marketplace.messaging;

import com.flagship.marketplace.IntegrationTestSupport;
import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The test profile pages messages three at a time, so longer histories
 * exercise the paging iterator.
 */
class MessagingLedgerTest extends IntegrationTestSupport {

    @Autowired
    private MessagingLedger messagingLedger;

    @Autowired
    private TransactionStateMachine stateMachine;

    private Transaction transaction;

    @BeforeEach
    void openTransaction() {
        Listing listing = givenListing("15.00", DeliveryMethod.PICKUP);
        transaction = stateMachine.purchase(listing.getItemId(), buyer, null);
    }

    @Test
    @DisplayName("Posted messages follow the system message in order")
    void postAndList() {
        messagingLedger.postMessage(transaction.getId(), buyer, "When can I pick it up?");
        messagingLedger.postMessage(transaction.getId(), seller, "  Tomorrow after 5  ");

        List<Message> history = messagingLedger.listMessages(transaction.getId(), buyer).stream().toList();

        assertEquals(3, history.size());
        assertEquals(SenderType.SYSTEM, history.get(0).getSenderType());
        assertTrue(history.get(0).isSystem());
        assertEquals(SenderType.BUYER, history.get(1).getSenderType());
        assertEquals(SenderType.SELLER, history.get(2).getSenderType());
        assertEquals("Tomorrow after 5", history.get(2).getMessage());
        assertTrue(history.get(1).getSequenceNumber() < history.get(2).getSequenceNumber());
    }

    @Test
    @DisplayName("Histories longer than a page are read completely")
    void paging() {
        IntStream.range(0, 7).forEach(i ->
                messagingLedger.postMessage(transaction.getId(), i % 2 == 0 ? buyer : seller, "Message " + i));

        List<String> texts = messagingLedger.listMessages(transaction.getId(), admin).stream()
                .map(Message::getMessage)
                .toList();

        assertEquals(8, texts.size());
        assertEquals("Message 0", texts.get(1));
        assertEquals("Message 6", texts.get(7));
    }

    @Test
    @DisplayName("An iteration stops at the newest message present when it began")
    void snapshotBound() {
        messagingLedger.postMessage(transaction.getId(), buyer, "First");
        MessageHistory history = messagingLedger.listMessages(transaction.getId(), buyer);

        Iterator<Message> iterator = history.iterator();
        messagingLedger.postMessage(transaction.getId(), seller, "Posted during iteration");

        int seen = 0;
        while (iterator.hasNext()) {
            iterator.next();
            seen++;
        }
        assertEquals(2, seen);
        assertEquals(3, history.stream().count());
    }

    @Test
    @DisplayName("Posting notifies the counterparty")
    void notifiesCounterparty() {
        messagingLedger.postMessage(transaction.getId(), buyer, "Hello");

        List<NotificationEvent> posted = notificationsFor(NotificationEvent.TRANSACTION, transaction.getId()).stream()
                .filter(n -> n.getType() == NotificationType.MESSAGE_POSTED)
                .toList();
        assertEquals(1, posted.size());
        assertEquals(sellerId, posted.get(0).getRecipientId());
    }

    @Test
    @DisplayName("Only parties post, blank and oversized texts are rejected, closed transactions are read-only")
    void postingRules() {
        Actor stranger = Actor.member(UUID.randomUUID());

        assertEquals(ErrorKind.NOT_AUTHORIZED, assertThrows(MarketplaceException.class,
                () -> messagingLedger.postMessage(transaction.getId(), stranger, "Hi")).getKind());
        assertEquals(ErrorKind.NOT_AUTHORIZED, assertThrows(MarketplaceException.class,
                () -> messagingLedger.postMessage(transaction.getId(), admin, "Hi")).getKind());
        assertEquals(ErrorKind.VALIDATION_ERROR, assertThrows(MarketplaceException.class,
                () -> messagingLedger.postMessage(transaction.getId(), buyer, "   ")).getKind());
        assertEquals(ErrorKind.VALIDATION_ERROR, assertThrows(MarketplaceException.class,
                () -> messagingLedger.postMessage(transaction.getId(), buyer, "x".repeat(2001))).getKind());

        stateMachine.cancel(transaction.getId(), buyer, "No longer needed", null);
        assertEquals(ErrorKind.INVALID_STATE, assertThrows(MarketplaceException.class,
                () -> messagingLedger.postMessage(transaction.getId(), buyer, "Hi")).getKind());
        assertEquals(ErrorKind.NOT_AUTHORIZED, assertThrows(MarketplaceException.class,
                () -> messagingLedger.listMessages(transaction.getId(), stranger)).getKind());
    }

    @Test
    @DisplayName("Marking read covers messages from others only")
    void markRead() {
        messagingLedger.postMessage(transaction.getId(), buyer, "Ping");
        messagingLedger.postMessage(transaction.getId(), seller, "Pong");

        assertEquals(2, messagingLedger.markRead(transaction.getId(), seller));
        assertEquals(0, messagingLedger.markRead(transaction.getId(), seller));

        List<Message> history = messagingLedger.listMessages(transaction.getId(), seller).stream().toList();
        assertNotNull(history.get(1).getReadAt());
        assertNull(history.get(2).getReadAt());
    }
}
