package com.flagship.marketplace.evidence;

import com.flagship.marketplace.IntegrationTestSupport;
import com.flagship.marketplace.error.ErrorKind;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.listing.Listing;
import com.flagship.marketplace.messaging.Message;
import com.flagship.marketplace.messaging.MessagingLedger;
import com.flagship.marketplace.transaction.DeliveryStatus;
import com.flagship.marketplace.transaction.PaymentStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStateMachine;
import com.flagship.marketplace.transaction.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceStoreTest extends IntegrationTestSupport {

    @Autowired
    private EvidenceStore evidenceStore;

    @Autowired
    private FileSystemEvidenceStorage storage;

    @Autowired
    private TransactionStateMachine stateMachine;

    @Autowired
    private TransactionStore transactionStore;

    @Autowired
    private MessagingLedger messagingLedger;

    private Transaction transaction;

    @BeforeEach
    void openTransaction() {
        Listing listing = givenListing("99.00", DeliveryMethod.PICKUP);
        transaction = stateMachine.purchase(listing.getItemId(), buyer, null);
    }

    private List<String> messageTexts() {
        return messagingLedger.listMessages(transaction.getId(), admin).stream().map(Message::getMessage).toList();
    }

    @Test
    @DisplayName("A receipt moves payment to PROCESSING and bumps the version")
    void receipt() {
        EvidenceRef receipt = evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT,
                "receipts/123.pdf", buyer);

        assertEquals(buyerId, receipt.getAddedBy());
        Transaction current = transactionStore.get(transaction.getId());
        assertEquals(PaymentStatus.PROCESSING, current.getPaymentStatus());
        assertEquals(2L, current.getVersion());
        assertTrue(messageTexts().contains("Payment receipt uploaded. Awaiting payment confirmation."));
    }

    @Test
    @DisplayName("References longer than 255 characters are rejected without touching the transaction")
    void referenceLength() {
        assertEquals(ErrorKind.VALIDATION_ERROR, assertThrows(MarketplaceException.class,
                () -> evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT, "r".repeat(256), buyer))
                .getKind());
        assertEquals(1L, transactionStore.get(transaction.getId()).getVersion());
        assertEquals(0, countRows("evidence_refs"));

        EvidenceRef longest = evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT,
                "r".repeat(255), buyer);
        assertEquals(255, longest.getStorageRef().length());
    }

    @Test
    @DisplayName("Receipts belong to the buyer and only while pending")
    void receiptRules() {
        assertEquals(ErrorKind.NOT_AUTHORIZED, assertThrows(MarketplaceException.class,
                () -> evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT, "r1", seller)).getKind());

        stateMachine.markPaid(transaction.getId(), buyer, null);

        assertEquals(ErrorKind.INVALID_STATE, assertThrows(MarketplaceException.class,
                () -> evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT, "r1", buyer)).getKind());
    }

    @Test
    @DisplayName("Delivery proofs are added by the seller once paid and listed on the transaction")
    void deliveryProof() {
        assertEquals(ErrorKind.INVALID_STATE, assertThrows(MarketplaceException.class,
                () -> evidenceStore.addEvidence(transaction.getId(), EvidenceKind.DELIVERY_PROOF, "p1", seller))
                .getKind());

        stateMachine.markPaid(transaction.getId(), buyer, null);
        stateMachine.setDeliveryStatus(transaction.getId(), seller, DeliveryStatus.DELIVERED, null);
        evidenceStore.addEvidence(transaction.getId(), EvidenceKind.DELIVERY_PROOF, "p1", seller);
        evidenceStore.addEvidence(transaction.getId(), EvidenceKind.DELIVERY_PROOF, "p2", seller);

        assertEquals(List.of("p1", "p2"), evidenceStore.deliveryProofImages(transaction.getId()));
        assertEquals(2, evidenceStore.listEvidence(transaction.getId(), buyer).size());
        assertEquals(ErrorKind.VALIDATION_ERROR, assertThrows(MarketplaceException.class,
                () -> evidenceStore.addEvidence(transaction.getId(), EvidenceKind.DELIVERY_PROOF, "p1", seller))
                .getKind());
    }

    @Test
    @DisplayName("Uploads are stored and removals delete the stored object after commit")
    void uploadAndRemove() {
        EvidenceRef uploaded = evidenceStore.uploadEvidence(transaction.getId(), EvidenceKind.RECEIPT,
                "receipt".getBytes(StandardCharsets.UTF_8), buyer);
        assertTrue(storage.exists(uploaded.getStorageRef()));

        assertEquals(ErrorKind.NOT_AUTHORIZED, assertThrows(MarketplaceException.class,
                () -> evidenceStore.removeEvidence(transaction.getId(), uploaded.getStorageRef(), seller)).getKind());

        evidenceStore.removeEvidence(transaction.getId(), uploaded.getStorageRef(), buyer);

        assertFalse(storage.exists(uploaded.getStorageRef()));
        assertTrue(evidenceStore.listEvidence(transaction.getId(), buyer).isEmpty());
        assertTrue(messageTexts().contains("Payment receipt removed."));
    }

    @Test
    @DisplayName("Empty uploads are rejected")
    void emptyUpload() {
        MarketplaceException e = assertThrows(MarketplaceException.class, () -> evidenceStore.uploadEvidence(
                transaction.getId(), EvidenceKind.RECEIPT, new byte[0], buyer));

        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
        assertEquals(0, countRows("evidence_refs"));
        assertEquals(1L, transactionStore.get(transaction.getId()).getVersion());
    }

    @Test
    @DisplayName("Administrators can remove evidence outside the window")
    void adminRemoval() {
        evidenceStore.addEvidence(transaction.getId(), EvidenceKind.RECEIPT, "r1", buyer);
        stateMachine.markPaid(transaction.getId(), buyer, null);

        assertEquals(ErrorKind.INVALID_STATE, assertThrows(MarketplaceException.class,
                () -> evidenceStore.removeEvidence(transaction.getId(), "r1", buyer)).getKind());
        evidenceStore.removeEvidence(transaction.getId(), "r1", admin);

        assertEquals(0, countRows("evidence_refs"));
    }
}
