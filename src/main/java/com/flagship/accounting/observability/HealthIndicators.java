package com.flagship.accounting.observability;

import com.flagship.accounting.outbox.OutboxEventRepository;
import com.flagship.accounting.period.FinancialPeriodService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Actuator health contributors for the accounting core.
 */
public class HealthIndicators {

    /**
     * DOWN when the outbox backlog passes the critical threshold; events are still safe in the table.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();
                return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * WARNING when no OPEN period covers today: postings dated today would be rejected.
     */
    @Component("postingPeriodHealth")
    public static class PostingPeriodHealthIndicator implements HealthIndicator {

        private final FinancialPeriodService periodService;

        public PostingPeriodHealthIndicator(FinancialPeriodService periodService) {
            this.periodService = periodService;
        }

        @Override
        public Health health() {
            LocalDate today = LocalDate.now();
            try {
                return periodService.hasOpenPeriod(today)
                    ? Health.up().withDetail("date", today.toString()).build()
                    : Health.status("WARNING")
                        .withDetail("date", today.toString())
                        .withDetail("note", "No OPEN financial period covers today")
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage is DEGRADED, not DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                    .withDetail("note", "Redis not configured; idempotency uses the database")
                    .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                    ? Health.up().withDetail("response", result).build()
                    : Health.status("DEGRADED").withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", "Idempotency falls back to the database")
                    .build();
            }
        }
    }
}
