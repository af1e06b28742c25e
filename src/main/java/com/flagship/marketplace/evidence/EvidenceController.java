package com.flagship.marketplace.evidence;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.evidence.dto.AddEvidenceRequest;
import com.flagship.marketplace.evidence.dto.EvidenceResponse;
import com.flagship.marketplace.identity.IdentityProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/transactions/{transactionId}/evidence")
@RequiredArgsConstructor
public class EvidenceController {

    private final EvidenceStore evidenceStore;
    private final IdentityProvider identityProvider;

    @GetMapping
    public List<EvidenceResponse> listEvidence(@PathVariable("transactionId") UUID transactionId) {
        return evidenceStore.listEvidence(transactionId, identityProvider.currentUser()).stream()
                .map(EvidenceResponse::from)
                .toList();
    }

    /**
     * Attaches a reference to an object stored elsewhere.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EvidenceResponse> addEvidence(@PathVariable("transactionId") UUID transactionId,
                                                        @RequestBody AddEvidenceRequest request) {
        EvidenceRef evidence = evidenceStore.addEvidence(transactionId, request.getKind(), request.getRef(),
                identityProvider.currentUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(EvidenceResponse.from(evidence));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<EvidenceResponse> uploadEvidence(@PathVariable("transactionId") UUID transactionId,
                                                           @RequestParam("kind") EvidenceKind kind,
                                                           @RequestPart("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw MarketplaceException.validation("Could not read uploaded file: " + e.getMessage());
        }
        EvidenceRef evidence = evidenceStore.uploadEvidence(transactionId, kind, content,
                identityProvider.currentUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(EvidenceResponse.from(evidence));
    }

    @DeleteMapping
    public ResponseEntity<Void> removeEvidence(@PathVariable("transactionId") UUID transactionId,
                                               @RequestParam("ref") String ref) {
        evidenceStore.removeEvidence(transactionId, ref, identityProvider.currentUser());
        return ResponseEntity.noContent().build();
    }
}
