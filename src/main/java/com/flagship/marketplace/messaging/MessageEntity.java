package com.flagship.marketplace.messaging;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only row of {@code transaction_messages}. The database assigns the
 * sequence number used for ordering and paging.
 */
@Entity
@Table(name = "transaction_messages")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MessageEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "sender_id", nullable = false, updatable = false)
    private UUID senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender_type", nullable = false, updatable = false, length = 10)
    private SenderType senderType;

    @Column(name = "message", nullable = false, updatable = false, length = 4000)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;

    public static MessageEntity fromDomain(Message message) {
        MessageEntity entity = new MessageEntity();
        entity.id = message.getId();
        entity.transactionId = message.getTransactionId();
        entity.senderId = message.getSenderId();
        entity.senderType = message.getSenderType();
        entity.message = message.getMessage();
        entity.createdAt = message.getCreatedAt();
        entity.readAt = message.getReadAt();
        return entity;
    }

    public Message toDomain() {
        return Message.builder()
                .id(id)
                .transactionId(transactionId)
                .senderId(senderId)
                .senderType(senderType)
                .message(message)
                .createdAt(createdAt)
                .readAt(readAt)
                .sequenceNumber(sequenceNumber)
                .build();
    }
}
