package com.flagship.accounting.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the accounting core.
 *
 * Metrics exposed:
 * - journal.posted: journal entries posted, by entry type and outcome
 * - journal.reversed: reversals, by outcome
 * - voucher.transitions: voucher workflow transitions, by transition and outcome
 * - depreciation.entries: depreciation entries written, by method and whether they reached the ledger
 * - posting.latency: timer per write operation
 * - idempotency.cache: hit/miss of the posting idempotency lookup
 */
@Component
public class AccountingMetrics {

    private final MeterRegistry registry;
    private final Counter periodsClosed;

    public AccountingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.periodsClosed = Counter.builder("period.closed")
                .description("Number of financial periods closed")
                .register(registry);
    }

    public void recordJournalPosted(String entryType, String status) {
        registry.counter("journal.posted",
                "entry_type", sanitizeTag(entryType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordJournalReversed(String status) {
        registry.counter("journal.reversed", "status", sanitizeTag(status)).increment();
    }

    public void recordVoucherTransition(String transition, String status) {
        registry.counter("voucher.transitions",
                "transition", sanitizeTag(transition),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordDepreciationEntry(String method, boolean posted) {
        registry.counter("depreciation.entries",
                "method", sanitizeTag(method),
                "posted", String.valueOf(posted)
        ).increment();
    }

    public void recordPeriodClosed() {
        periodsClosed.increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("posting.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
