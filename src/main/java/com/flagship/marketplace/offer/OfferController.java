package com.flagship.marketplace.offer;

import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.identity.IdentityProvider;
import com.flagship.marketplace.idempotency.IdempotencyService;
import com.flagship.marketplace.offer.dto.CreateOfferRequest;
import com.flagship.marketplace.offer.dto.OfferDecisionResponse;
import com.flagship.marketplace.offer.dto.OfferResponse;
import com.flagship.marketplace.offer.dto.RespondToOfferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for offers.
 *
 * Creating an offer is idempotent when an Idempotency-Key header is sent:
 * a repeated key returns the offer created by the first request.
 */
@RestController
@RequestMapping("/api/offers")
@RequiredArgsConstructor
@Slf4j
public class OfferController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String IDEMPOTENCY_SCOPE = "offer.create";

    private final OfferEngine offerEngine;
    private final IdempotencyService idempotencyService;
    private final IdentityProvider identityProvider;

    @PostMapping
    @Transactional
    public ResponseEntity<OfferResponse> createOffer(
            @Valid @RequestBody CreateOfferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        Actor buyer = identityProvider.currentUser();

        if (idempotencyKey != null) {
            Optional<UUID> existing = idempotencyService.findResource(IDEMPOTENCY_SCOPE, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning existing offer {}", existing.get());
                return ResponseEntity.ok(OfferResponse.from(offerEngine.getOffer(existing.get(), buyer)));
            }
        }

        Offer offer = offerEngine.createOffer(request.getItemId(), buyer, request.getSellerId(),
                request.getAmount(), request.getNote(), request.getTtl());

        if (idempotencyKey != null) {
            idempotencyService.remember(IDEMPOTENCY_SCOPE, idempotencyKey, offer.getId());
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(OfferResponse.from(offer));
    }

    @GetMapping
    public List<OfferResponse> listOffers() {
        return offerEngine.listForUser(identityProvider.currentUser()).stream()
                .map(OfferResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public OfferResponse getOffer(@PathVariable("id") UUID id) {
        return OfferResponse.from(offerEngine.getOffer(id, identityProvider.currentUser()));
    }

    @PostMapping("/{id}/respond")
    public OfferDecisionResponse respond(@PathVariable("id") UUID id,
                                         @Valid @RequestBody RespondToOfferRequest request) {
        OfferDecision decision = offerEngine.respondToOffer(id, identityProvider.currentUser(), request.getAction());
        return OfferDecisionResponse.from(decision);
    }

    @PostMapping("/{id}/cancel")
    public OfferResponse cancel(@PathVariable("id") UUID id) {
        return OfferResponse.from(offerEngine.cancelOffer(id, identityProvider.currentUser()));
    }
}
