package com.flagship.marketplace.observability;

import com.flagship.marketplace.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators exposed through {@code /actuator/health}.
 */
public class HealthIndicators {

    /**
     * Reports WARNING once undispatched notifications pile up and DOWN at ten times that.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warningThreshold;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.pending-threshold:1000}") long warningThreshold) {
            this.outboxRepository = outboxRepository;
            this.warningThreshold = warningThreshold;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long criticalThreshold = warningThreshold * 10;

                Health.Builder builder = backlogSize < warningThreshold
                        ? Health.up()
                        : backlogSize < criticalThreshold
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", warningThreshold)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only caches idempotency keys, so an outage degrades the service
     * but does not take it down.
     */
    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys are served from the database";

        private final StringRedisTemplate redisTemplate;
        private final boolean enabled;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate,
                                    @Value("${marketplace.idempotency.redis-enabled:true}") boolean enabled) {
            this.redisTemplate = redisTemplate;
            this.enabled = enabled;
        }

        @Override
        public Health health() {
            if (!enabled) {
                return Health.up().withDetail("redis", "disabled").build();
            }
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
