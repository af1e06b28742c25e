package com.flagship.marketplace.observability;

import com.flagship.marketplace.error.MarketplaceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Metrics for offer and transaction operations.
 *
 * Metrics exposed:
 * - marketplace.operations: counter tagged by operation and outcome
 *   (success or the error kind that rejected the call)
 * - marketplace.operations.duration: timer tagged by operation
 * - marketplace.version_conflicts: lost optimistic races, tagged by aggregate
 * - marketplace.offers.expired / marketplace.transactions.auto_completed: background job output
 * - marketplace.idempotency: replayed vs new requests
 */
@Component
public class MarketplaceMetrics {

    private final MeterRegistry registry;

    private final Counter offersExpired;
    private final Counter transactionsAutoCompleted;

    public MarketplaceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.offersExpired = Counter.builder("marketplace.offers.expired")
                .description("Offers expired by the sweep")
                .register(registry);

        this.transactionsAutoCompleted = Counter.builder("marketplace.transactions.auto_completed")
                .description("Delivered transactions completed automatically")
                .register(registry);
    }

    /**
     * Runs an operation, recording its latency and outcome.
     * Exceptions propagate unchanged.
     */
    public <T> T record(String operation, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";
        try {
            return work.get();
        } catch (MarketplaceException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(registry.timer("marketplace.operations.duration", "operation", operation));
            registry.counter("marketplace.operations",
                    "operation", operation,
                    "outcome", outcome
            ).increment();
        }
    }

    public void recordVersionConflict(String aggregate) {
        registry.counter("marketplace.version_conflicts", "aggregate", aggregate).increment();
    }

    public void recordOffersExpired(int count) {
        offersExpired.increment(count);
    }

    public void recordAutoCompleted(int count) {
        transactionsAutoCompleted.increment(count);
    }

    public void recordIdempotencyHit(String scope) {
        registry.counter("marketplace.idempotency", "scope", scope, "result", "replayed").increment();
    }

    public void recordIdempotencyMiss(String scope) {
        registry.counter("marketplace.idempotency", "scope", scope, "result", "new").increment();
    }
}
