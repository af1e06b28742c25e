package com.flagship.marketplace;

import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.offer.Offer;
import com.flagship.marketplace.offer.OfferAction;
import com.flagship.marketplace.offer.OfferEngine;
import com.flagship.marketplace.offer.OfferStatus;
import com.flagship.marketplace.offer.OfferStore;
import com.flagship.marketplace.transaction.DeliveryStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStateMachine;
import com.flagship.marketplace.transaction.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races that depend on real row locks and unique indexes, run against
 * PostgreSQL. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresConcurrencyTest extends IntegrationTestSupport {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("marketplace_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private OfferEngine offerEngine;

    @Autowired
    private OfferStore offerStore;

    @Autowired
    private TransactionStateMachine stateMachine;

    private static List<Object> race(Callable<Object> first, Callable<Object> second) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = List.of(
                    executor.submit(() -> {
                        start.await();
                        return first.call();
                    }),
                    executor.submit(() -> {
                        start.await();
                        return second.call();
                    }));
            start.countDown();
            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    outcomes.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    outcomes.add(e.getCause());
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static void assertLostRace(Object outcome) {
        MarketplaceException failure = assertInstanceOf(MarketplaceException.class, outcome);
        assertTrue(failure.getKind() == ErrorKind.VERSION_CONFLICT || failure.getKind() == ErrorKind.INVALID_STATE,
                failure.getMessage());
    }

    @Test
    @DisplayName("An accepted offer runs through payment and delivery to completion")
    void happyPath() {
        Listing listing = givenListing("75.00", DeliveryMethod.DELIVERY);
        Offer offer = offerEngine.createOffer(listing.getItemId(), buyer, sellerId, new BigDecimal("50"), null, null);

        Transaction transaction = offerEngine.respondToOffer(offer.getId(), seller, OfferAction.ACCEPT)
                .transaction().orElseThrow();
        assertEquals(0, new BigDecimal("50.00").compareTo(transaction.getAmount()));
        assertEquals(TransactionStatus.PENDING, transaction.getStatus());

        UUID id = transaction.getId();
        stateMachine.setDeliveryAddress(id, buyer, "1 Main St", null);
        stateMachine.markPaid(id, Actor.system(), null);
        stateMachine.setDeliveryStatus(id, seller, DeliveryStatus.IN_TRANSIT, null);
        stateMachine.setDeliveryStatus(id, seller, DeliveryStatus.DELIVERED, null);
        Transaction completed = stateMachine.complete(id, buyer, null);

        assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getCompletedAt());
        assertEquals(6L, completed.getVersion());
        assertEquals(OfferStatus.ACCEPTED, offerStore.get(offer.getId()).getStatus());
    }

    @Test
    @DisplayName("Accepting two offers on one item at once sells it exactly once")
    void concurrentAccepts() throws Exception {
        Listing listing = givenListing("120.00", DeliveryMethod.DELIVERY);
        Actor otherBuyer = Actor.member(UUID.randomUUID());
        Offer first = offerEngine.createOffer(listing.getItemId(), buyer, sellerId, new BigDecimal("100"), null, null);
        Offer second = offerEngine.createOffer(listing.getItemId(), otherBuyer, sellerId, new BigDecimal("110"), null, null);

        List<Object> outcomes = race(
                () -> offerEngine.respondToOffer(first.getId(), seller, OfferAction.ACCEPT),
                () -> offerEngine.respondToOffer(second.getId(), seller, OfferAction.ACCEPT));

        long wins = outcomes.stream().filter(o -> !(o instanceof Throwable)).count();
        assertEquals(1, wins, () -> "outcomes: " + outcomes);
        outcomes.stream().filter(Throwable.class::isInstance).forEach(PostgresConcurrencyTest::assertLostRace);

        assertEquals(1, countRows("marketplace_transactions"));
        List<OfferStatus> statuses = List.of(
                offerStore.get(first.getId()).getStatus(),
                offerStore.get(second.getId()).getStatus());
        assertTrue(statuses.contains(OfferStatus.ACCEPTED));
        assertTrue(statuses.contains(OfferStatus.CANCELLED));
    }

    @Test
    @DisplayName("Two writers on the same transaction version: one wins, the other changes nothing")
    void concurrentTransactionWrites() throws Exception {
        Listing listing = givenListing("40.00", DeliveryMethod.DELIVERY);
        Transaction transaction = stateMachine.purchase(listing.getItemId(), buyer, "1 Main St");
        long version = transaction.getVersion();
        AtomicInteger cancelled = new AtomicInteger();

        List<Object> outcomes = race(
                () -> stateMachine.setDeliveryAddress(transaction.getId(), buyer, "2 High St", version),
                () -> {
                    Transaction result = stateMachine.cancel(transaction.getId(), buyer, "Changed my mind", version);
                    cancelled.incrementAndGet();
                    return result;
                });

        assertEquals(1, outcomes.stream().filter(o -> !(o instanceof Throwable)).count(), () -> "outcomes: " + outcomes);
        outcomes.stream().filter(Throwable.class::isInstance).forEach(PostgresConcurrencyTest::assertLostRace);

        Transaction stored = stateMachine.get(transaction.getId(), buyer);
        assertEquals(version + 1, stored.getVersion());
        if (cancelled.get() == 1) {
            assertEquals("1 Main St", stored.getDeliveryAddress());
        } else {
            assertEquals("2 High St", stored.getDeliveryAddress());
        }
    }
}
