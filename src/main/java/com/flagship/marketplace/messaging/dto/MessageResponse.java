package com.flagship.marketplace.messaging.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.messaging.Message;
import com.flagship.marketplace.messaging.SenderType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MessageResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("sender_id")
    UUID senderId;

    @JsonProperty("sender_type")
    SenderType senderType;

    @JsonProperty("message")
    String message;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("read_at")
    Instant readAt;

    public static MessageResponse from(Message message) {
        return MessageResponse.builder()
            .id(message.getId())
            .transactionId(message.getTransactionId())
            .senderId(message.getSenderId())
            .senderType(message.getSenderType())
            .message(message.getMessage())
            .createdAt(message.getCreatedAt())
            .readAt(message.getReadAt())
            .build();
    }
}
