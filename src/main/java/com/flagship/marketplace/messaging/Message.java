package com.flagship.marketplace.messaging;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a transaction's conversation. Text and sender never change
 * after creation; only {@code readAt} is recorded later.
 */
@Value
@Builder
@Jacksonized
public class Message {
    UUID id;
    UUID transactionId;
    UUID senderId;
    SenderType senderType;
    String message;
    Instant createdAt;
    Instant readAt;
    Long sequenceNumber;

    public static Message create(UUID transactionId, UUID senderId, SenderType senderType,
                                 String text, Instant now) {
        return Message.builder()
                .id(UUID.randomUUID())
                .transactionId(transactionId)
                .senderId(senderId)
                .senderType(senderType)
                .message(text)
                .createdAt(now)
                .build();
    }

    @JsonIgnore
    public boolean isSystem() {
        return senderType == SenderType.SYSTEM;
    }
}
