package com.flagship.accounting.period;

/**
 * Contributes documents that must reach a final state before a period may close.
 * The journal engine and the voucher workflow each register one.
 */
public interface PeriodCloseGuard {

    /**
     * Number of unfinished documents dated inside the period.
     */
    long countBlockingDocuments(FinancialPeriod period);

    /**
     * Short label used in the failure message, e.g. "journal entries".
     */
    String documentLabel();
}
