package com.flagship.accounting.observability;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The id comes from the X-Correlation-ID request header or is generated, and is
 * copied into MDC so every log line of a request carries it. Write paths add the id
 * of the journal entry, voucher or asset they are working on under the keys below.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String JOURNAL_ENTRY_ID_MDC_KEY = "journalEntryId";
    public static final String VOUCHER_ID_MDC_KEY = "voucherId";
    public static final String ASSET_ID_MDC_KEY = "assetId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Sets the correlation ID for the current thread.
     */
    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     * Should be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
