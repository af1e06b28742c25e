package com.flagship.marketplace.evidence;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.error.VersionConflictException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.observability.MarketplaceMetrics;
import com.flagship.marketplace.transaction.PaymentStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStatus;
import com.flagship.marketplace.transaction.TransactionStore;
import com.flagship.marketplace.transaction.TransitionJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Receipts and delivery proofs attached to a transaction.
 *
 * Who may manage evidence depends on its kind and the transaction state:
 * - RECEIPT: the buyer, while the transaction is PENDING
 * - DELIVERY_PROOF: the seller, while PAID, SHIPPED or DELIVERED
 *
 * Adding or removing evidence bumps the transaction's version, so evidence
 * changes are ordered against concurrent transitions. Removal is allowed to
 * the adder within the same window, and to administrators at any time.
 */
@Service
@Slf4j
public class EvidenceStore {

    // width of evidence_refs.storage_ref
    static final int MAX_REF_LENGTH = 255;

    private static final Set<TransactionStatus> DELIVERY_PROOF_WINDOW =
            EnumSet.of(TransactionStatus.PAID, TransactionStatus.SHIPPED, TransactionStatus.DELIVERED);

    private final EvidenceRepository repository;
    private final EvidenceStorage storage;
    private final TransactionStore transactionStore;
    private final TransitionJournal journal;
    private final MarketplaceMetrics metrics;
    private final Clock clock;
    private final long maxSizeBytes;

    public EvidenceStore(EvidenceRepository repository,
                         EvidenceStorage storage,
                         TransactionStore transactionStore,
                         TransitionJournal journal,
                         MarketplaceMetrics metrics,
                         Clock clock,
                         @Value("${marketplace.evidence.max-size-bytes:5242880}") long maxSizeBytes) {
        this.repository = repository;
        this.storage = storage;
        this.transactionStore = transactionStore;
        this.journal = journal;
        this.metrics = metrics;
        this.clock = clock;
        this.maxSizeBytes = maxSizeBytes;
    }

    /**
     * Attaches a reference to an object that is already stored.
     */
    @Transactional
    public EvidenceRef addEvidence(UUID transactionId, EvidenceKind kind, String ref, Actor actor) {
        return metrics.record("evidence.add", () -> {
            Transaction transaction = transactionStore.get(transactionId);
            requireKind(kind);
            String storageRef = ref == null || ref.isBlank() ? null : ref.strip();
            if (storageRef == null) {
                throw MarketplaceException.validation("Evidence reference is required");
            }
            if (storageRef.length() > MAX_REF_LENGTH) {
                throw MarketplaceException.validation(
                        String.format("Evidence reference exceeds %d characters", MAX_REF_LENGTH));
            }
            requireMayAdd(transaction, kind, actor);
            return attach(transaction, kind, storageRef, actor);
        });
    }

    /**
     * Stores the bytes, then attaches the new reference. If the database
     * transaction rolls back, the stored object is deleted again.
     */
    @Transactional
    public EvidenceRef uploadEvidence(UUID transactionId, EvidenceKind kind, byte[] content, Actor actor) {
        return metrics.record("evidence.upload", () -> {
            Transaction transaction = transactionStore.get(transactionId);
            requireKind(kind);
            if (content == null || content.length == 0) {
                throw MarketplaceException.validation("Evidence file is empty");
            }
            if (content.length > maxSizeBytes) {
                throw MarketplaceException.validation(
                        String.format("Evidence file exceeds %d bytes", maxSizeBytes));
            }
            requireMayAdd(transaction, kind, actor);

            String storageRef = storage.put(content);
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        deleteQuietly(storageRef);
                    }
                }
            });
            return attach(transaction, kind, storageRef, actor);
        });
    }

    @Transactional
    public void removeEvidence(UUID transactionId, String ref, Actor actor) {
        metrics.record("evidence.remove", () -> {
            Transaction transaction = transactionStore.get(transactionId);
            EvidenceEntity evidence = repository.findByTransactionIdAndStorageRef(transactionId, ref)
                    .orElseThrow(() -> MarketplaceException.notFound("Evidence", ref));

            if (!actor.isAdministrator()) {
                if (!actor.is(evidence.getAddedBy())) {
                    throw MarketplaceException.notAuthorized(
                            String.format("Only the user who added evidence %s can remove it", ref));
                }
                requireWindow(transaction, evidence.getKind(), "remove");
            }

            Instant now = Instant.now(clock);
            Transaction touched = bumpVersion(transaction, tx -> tx.touch(now));
            repository.delete(evidence);
            repository.flush();

            journal.record(touched, actor, NotificationType.EVIDENCE_REMOVED,
                    describe(evidence.getKind()) + " removed.", now);

            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deleteQuietly(ref);
                }
            });

            log.info("Evidence removed: transactionId={}, kind={}, ref={}", transactionId, evidence.getKind(), ref);
            return null;
        });
    }

    /**
     * Evidence of a transaction in insertion order, for its parties and administrators.
     */
    @Transactional(readOnly = true)
    public List<EvidenceRef> listEvidence(UUID transactionId, Actor actor) {
        Transaction transaction = transactionStore.get(transactionId);
        if (!actor.isAdministrator() && transaction.partyOf(actor.getId()).isEmpty()) {
            throw MarketplaceException.notAuthorized(
                    String.format("User %s cannot view evidence of transaction %s", actor.getId(), transactionId));
        }
        return repository.findByTransactionIdOrderBySequenceNumberAsc(transactionId).stream()
                .map(EvidenceEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> deliveryProofImages(UUID transactionId) {
        return repository.findByTransactionIdAndKindOrderBySequenceNumberAsc(transactionId, EvidenceKind.DELIVERY_PROOF)
                .stream()
                .map(EvidenceEntity::getStorageRef)
                .toList();
    }

    private EvidenceRef attach(Transaction transaction, EvidenceKind kind, String storageRef, Actor actor) {
        UUID transactionId = transaction.getId();
        if (repository.existsByTransactionIdAndStorageRef(transactionId, storageRef)) {
            throw MarketplaceException.validation(
                    String.format("Evidence %s is already attached to transaction %s", storageRef, transactionId));
        }

        Instant now = Instant.now(clock);
        boolean awaitingConfirmation = kind == EvidenceKind.RECEIPT
                && (transaction.getPaymentStatus() == PaymentStatus.PENDING
                || transaction.getPaymentStatus() == PaymentStatus.FAILED);
        Transaction updated = bumpVersion(transaction,
                tx -> awaitingConfirmation ? tx.markPaymentProcessing(now) : tx.touch(now));

        EvidenceRef saved = repository.saveAndFlush(EvidenceEntity.fromDomain(
                EvidenceRef.create(transactionId, kind, storageRef, actor.getId(), now))).toDomain();

        String summary = kind == EvidenceKind.RECEIPT
                ? "Payment receipt uploaded. Awaiting payment confirmation."
                : "Delivery proof added.";
        journal.record(updated, actor, NotificationType.EVIDENCE_ADDED, summary, now);

        log.info("Evidence added: transactionId={}, kind={}, ref={}", transactionId, kind, storageRef);
        return saved;
    }

    private Transaction bumpVersion(Transaction transaction, UnaryOperator<Transaction> change) {
        try {
            return transactionStore.update(transaction.getId(), transaction.getVersion(), change);
        } catch (VersionConflictException e) {
            metrics.recordVersionConflict("Transaction");
            throw e;
        }
    }

    private void requireMayAdd(Transaction transaction, EvidenceKind kind, Actor actor) {
        UUID allowed = kind == EvidenceKind.RECEIPT ? transaction.getBuyerId() : transaction.getSellerId();
        if (!actor.is(allowed)) {
            throw MarketplaceException.notAuthorized(String.format("Only the %s can add %s to transaction %s",
                    kind == EvidenceKind.RECEIPT ? "buyer" : "seller",
                    describe(kind).toLowerCase(Locale.ROOT), transaction.getId()));
        }
        requireWindow(transaction, kind, "add");
    }

    private void requireWindow(Transaction transaction, EvidenceKind kind, String action) {
        boolean open = kind == EvidenceKind.RECEIPT
                ? transaction.getStatus() == TransactionStatus.PENDING
                : DELIVERY_PROOF_WINDOW.contains(transaction.getStatus());
        if (!open) {
            throw MarketplaceException.invalidState(String.format("Cannot %s %s on transaction %s in %s status",
                    action, describe(kind).toLowerCase(Locale.ROOT), transaction.getId(), transaction.getStatus()));
        }
    }

    private static void requireKind(EvidenceKind kind) {
        if (kind == null) {
            throw MarketplaceException.validation("Evidence kind is required: RECEIPT or DELIVERY_PROOF");
        }
    }

    private static String describe(EvidenceKind kind) {
        return kind == EvidenceKind.RECEIPT ? "Payment receipt" : "Delivery proof";
    }

    private void deleteQuietly(String ref) {
        try {
            storage.delete(ref);
        } catch (RuntimeException e) {
            log.warn("Failed to delete evidence object {}: {}", ref, e.getMessage());
        }
    }
}
