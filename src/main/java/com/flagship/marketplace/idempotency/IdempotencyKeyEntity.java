package com.flagship.marketplace.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps a client-supplied idempotency key, per operation scope, to the
 * resource the first request created.
 */
@Entity
@Table(name = "idempotency_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyKeyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "scope", nullable = false, updatable = false, length = 50)
    private String scope;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "resource_id", nullable = false, updatable = false)
    private UUID resourceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static IdempotencyKeyEntity of(String scope, String idempotencyKey, UUID resourceId, Instant now) {
        IdempotencyKeyEntity entity = new IdempotencyKeyEntity();
        entity.id = UUID.randomUUID();
        entity.scope = scope;
        entity.idempotencyKey = idempotencyKey;
        entity.resourceId = resourceId;
        entity.createdAt = now;
        return entity;
    }
}
