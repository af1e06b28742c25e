package com.flagship.marketplace.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background jobs: offer expiry sweep, auto-completion,
 * outbox publishing and metric refresh.
 *
 * Disabled with {@code marketplace.scheduling.enabled=false}; the jobs stay
 * available as beans and can be triggered directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "marketplace.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
