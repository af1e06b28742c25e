package com.flagship.marketplace.idempotency;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.observability.MarketplaceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for create requests.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the {@code idempotency_keys} table, the source of truth
 * 3. Write the key to the table in the request's database transaction and
 *    to Redis only after that transaction commits
 *
 * Keys are scoped per operation, so the same key may be used for an offer
 * and for a purchase.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "marketplace:idempotency:";
    private static final int MAX_KEY_LENGTH = 255;

    private final IdempotencyKeyRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final MarketplaceMetrics metrics;
    private final Clock clock;
    private final Duration ttl;

    public IdempotencyService(IdempotencyKeyRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              MarketplaceMetrics metrics,
                              Clock clock,
                              @Value("${marketplace.idempotency.redis-enabled:true}") boolean redisEnabled,
                              @Value("${marketplace.idempotency.ttl:P1D}") Duration ttl) {
        this.repository = repository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
        this.metrics = metrics;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * @return id of the resource created by an earlier request with this key
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findResource(String scope, String idempotencyKey) {
        requireValidKey(idempotencyKey);

        Optional<UUID> cached = readCache(scope, idempotencyKey);
        if (cached.isPresent()) {
            metrics.recordIdempotencyHit(scope);
            log.debug("Idempotency key found in Redis: scope={}, key={}", scope, idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = repository.findByScopeAndIdempotencyKey(scope, idempotencyKey)
                .map(IdempotencyKeyEntity::getResourceId);
        if (stored.isPresent()) {
            metrics.recordIdempotencyHit(scope);
            log.debug("Idempotency key found in database: scope={}, key={}", scope, idempotencyKey);
            writeCache(scope, idempotencyKey, stored.get());
        } else {
            metrics.recordIdempotencyMiss(scope);
        }
        return stored;
    }

    /**
     * Records the key with the created resource. Must run in the creating
     * request's database transaction; a concurrent request with the same key
     * fails on the unique constraint and rolls back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void remember(String scope, String idempotencyKey, UUID resourceId) {
        requireValidKey(idempotencyKey);
        repository.saveAndFlush(IdempotencyKeyEntity.of(scope, idempotencyKey, resourceId, Instant.now(clock)));

        if (redisTemplate.isPresent()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    writeCache(scope, idempotencyKey, resourceId);
                }
            });
        }
    }

    private Optional<UUID> readCache(String scope, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(scope, idempotencyKey));
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}. Falling back to database. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String scope, String idempotencyKey, UUID resourceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(scope, idempotencyKey), resourceId.toString(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static String redisKey(String scope, String idempotencyKey) {
        return REDIS_KEY_PREFIX + scope + ":" + idempotencyKey;
    }

    private static void requireValidKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw MarketplaceException.validation("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw MarketplaceException.validation(
                    String.format("Idempotency key exceeds %d characters", MAX_KEY_LENGTH));
        }
    }
}
