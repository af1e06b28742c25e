package com.flagship.marketplace.messaging;

import com.flagship.marketplace.identity.IdentityProvider;
import com.flagship.marketplace.messaging.dto.MessageResponse;
import com.flagship.marketplace.messaging.dto.PostMessageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/transactions/{transactionId}/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessagingLedger messagingLedger;
    private final IdentityProvider identityProvider;

    @GetMapping
    public List<MessageResponse> listMessages(@PathVariable("transactionId") UUID transactionId) {
        return messagingLedger.listMessages(transactionId, identityProvider.currentUser()).stream()
                .map(MessageResponse::from)
                .toList();
    }

    @PostMapping
    public ResponseEntity<MessageResponse> postMessage(@PathVariable("transactionId") UUID transactionId,
                                                       @RequestBody PostMessageRequest request) {
        Message message = messagingLedger.postMessage(transactionId, identityProvider.currentUser(),
                request.getMessage());
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.from(message));
    }

    @PostMapping("/read")
    public Map<String, Integer> markRead(@PathVariable("transactionId") UUID transactionId) {
        return Map.of("marked", messagingLedger.markRead(transactionId, identityProvider.currentUser()));
    }
}
