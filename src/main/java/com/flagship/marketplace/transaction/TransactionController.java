package com.flagship.marketplace.transaction;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.evidence.EvidenceStore;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.identity.IdentityProvider;
import com.flagship.marketplace.idempotency.IdempotencyService;
import com.flagship.marketplace.transaction.dto.CancelRequest;
import com.flagship.marketplace.transaction.dto.DeliveryAddressRequest;
import com.flagship.marketplace.transaction.dto.DeliveryStatusRequest;
import com.flagship.marketplace.transaction.dto.ProblemReportRequest;
import com.flagship.marketplace.transaction.dto.PurchaseRequest;
import com.flagship.marketplace.transaction.dto.ResolveDisputeRequest;
import com.flagship.marketplace.transaction.dto.TrackingNumberRequest;
import com.flagship.marketplace.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for transactions.
 *
 * Mutating calls accept an optional {@code If-Match} header carrying the
 * version the caller last saw; a stale version is answered with 409
 * VERSION_CONFLICT. Every mutating call returns the updated transaction.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String IDEMPOTENCY_SCOPE = "transaction.purchase";

    private final TransactionStateMachine stateMachine;
    private final EvidenceStore evidenceStore;
    private final IdempotencyService idempotencyService;
    private final IdentityProvider identityProvider;

    @PostMapping
    @Transactional
    public ResponseEntity<TransactionResponse> purchase(
            @Valid @RequestBody PurchaseRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        Actor buyer = identityProvider.currentUser();

        if (idempotencyKey != null) {
            Optional<UUID> existing = idempotencyService.findResource(IDEMPOTENCY_SCOPE, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning existing transaction {}", existing.get());
                return ResponseEntity.ok(view(stateMachine.get(existing.get(), buyer)));
            }
        }

        Transaction transaction = stateMachine.purchase(request.getItemId(), buyer, request.getDeliveryAddress());

        if (idempotencyKey != null) {
            idempotencyService.remember(IDEMPOTENCY_SCOPE, idempotencyKey, transaction.getId());
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(view(transaction));
    }

    @GetMapping
    public List<TransactionResponse> listTransactions() {
        return stateMachine.listForUser(identityProvider.currentUser()).stream()
                .map(this::view)
                .toList();
    }

    @GetMapping("/{id}")
    public TransactionResponse getTransaction(@PathVariable("id") UUID id) {
        return view(stateMachine.get(id, identityProvider.currentUser()));
    }

    @PostMapping("/{id}/payment")
    public TransactionResponse markPaid(@PathVariable("id") UUID id,
                                        @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.markPaid(id, identityProvider.currentUser(), expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/delivery-status")
    public TransactionResponse setDeliveryStatus(@PathVariable("id") UUID id,
                                                 @Valid @RequestBody DeliveryStatusRequest request,
                                                 @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.setDeliveryStatus(id, identityProvider.currentUser(),
                request.getDeliveryStatus(), expectedVersion(ifMatch)));
    }

    @PutMapping("/{id}/delivery-address")
    public TransactionResponse setDeliveryAddress(@PathVariable("id") UUID id,
                                                  @RequestBody DeliveryAddressRequest request,
                                                  @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.setDeliveryAddress(id, identityProvider.currentUser(),
                request.getDeliveryAddress(), expectedVersion(ifMatch)));
    }

    @PutMapping("/{id}/tracking-number")
    public TransactionResponse setTrackingNumber(@PathVariable("id") UUID id,
                                                 @RequestBody TrackingNumberRequest request,
                                                 @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.setTrackingNumber(id, identityProvider.currentUser(),
                request.getTrackingNumber(), expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/complete")
    public TransactionResponse complete(@PathVariable("id") UUID id,
                                        @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.complete(id, identityProvider.currentUser(), expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/cancel")
    public TransactionResponse cancel(@PathVariable("id") UUID id,
                                      @RequestBody(required = false) CancelRequest request,
                                      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        String reason = request != null ? request.getReason() : null;
        return view(stateMachine.cancel(id, identityProvider.currentUser(), reason, expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/problem")
    public TransactionResponse reportProblem(@PathVariable("id") UUID id,
                                             @RequestBody(required = false) ProblemReportRequest request,
                                             @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        String description = request != null ? request.getDescription() : null;
        return view(stateMachine.reportProblem(id, identityProvider.currentUser(), description,
                expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/refund")
    public TransactionResponse refund(@PathVariable("id") UUID id,
                                      @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.refund(id, identityProvider.currentUser(), expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/resolve")
    public TransactionResponse resolveDispute(@PathVariable("id") UUID id,
                                              @Valid @RequestBody ResolveDisputeRequest request,
                                              @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return view(stateMachine.resolveDispute(id, identityProvider.currentUser(), request.getOutcome(),
                expectedVersion(ifMatch)));
    }

    private TransactionResponse view(Transaction transaction) {
        return TransactionResponse.from(transaction, evidenceStore.deliveryProofImages(transaction.getId()));
    }

    /**
     * Accepts {@code 3}, {@code "3"} or {@code W/"3"}.
     */
    static Long expectedVersion(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            return null;
        }
        String value = ifMatch.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        value = value.replace("\"", "");
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw MarketplaceException.validation("If-Match must carry a numeric version, got: " + ifMatch);
        }
    }
}
