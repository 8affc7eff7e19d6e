package com.flagship.fundraising_ledger.observability;

import com.flagship.fundraising_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors for the fundraising ledger.
 */
public class HealthIndicators {

    /**
     * Reports the notification backlog. A growing backlog means summaries
     * are fresh in the database but consumers are behind.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder;
                if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only caches idempotency keys; without it creates fall back to
     * the database, so an outage is DEGRADED rather than DOWN.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public IdempotencyCacheHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return degraded("Redis is not configured");
            }
            RedisConnectionFactory factory = template.getConnectionFactory();
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                if ("PONG".equals(pong)) {
                    return Health.up().withDetail("response", pong).build();
                }
                return degraded("Unexpected ping response: " + pong);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String reason) {
            return Health.status("DEGRADED")
                    .withDetail("error", reason)
                    .withDetail("fallback", "idempotency keys are read from the ledger tables")
                    .build();
        }
    }
}
