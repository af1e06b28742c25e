package com.flagship.marketplace.transaction;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.observability.MarketplaceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Completes delivered transactions the buyer never confirmed.
 *
 * Each transaction is completed in its own database transaction. A buyer
 * completing or disputing at the same moment wins; the job skips that row.
 */
@Component
@Slf4j
public class AutoCompletionJob {

    private static final int BATCH_SIZE = 200;

    private final TransactionStore transactionStore;
    private final TransactionStateMachine stateMachine;
    private final MarketplaceMetrics metrics;
    private final Clock clock;
    private final Duration completeAfter;

    public AutoCompletionJob(TransactionStore transactionStore,
                             TransactionStateMachine stateMachine,
                             MarketplaceMetrics metrics,
                             Clock clock,
                             @Value("${marketplace.transactions.auto-complete-after:P3D}") Duration completeAfter) {
        this.transactionStore = transactionStore;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.clock = clock;
        this.completeAfter = completeAfter;
    }

    @Scheduled(fixedDelayString = "${marketplace.transactions.auto-complete-interval-ms:300000}")
    public void run() {
        try {
            completeDelivered(Instant.now(clock).minus(completeAfter));
        } catch (RuntimeException e) {
            log.error("Auto-completion run failed", e);
        }
    }

    /**
     * @return number of transactions completed
     */
    public int completeDelivered(Instant cutoff) {
        int completed = 0;
        for (Transaction candidate : transactionStore.findDeliveredBefore(cutoff, BATCH_SIZE)) {
            try {
                if (stateMachine.autoComplete(candidate.getId(), cutoff)) {
                    completed++;
                }
            } catch (MarketplaceException e) {
                log.info("Skipped auto-completion of transaction {}: {}", candidate.getId(), e.getMessage());
            }
        }
        if (completed > 0) {
            metrics.recordAutoCompleted(completed);
            log.info("Auto-completed {} delivered transactions older than {}", completed, cutoff);
        }
        return completed;
    }
}
