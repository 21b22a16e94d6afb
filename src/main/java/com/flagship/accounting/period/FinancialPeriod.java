package com.flagship.accounting.period;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A posting window. Periods never overlap, so a date belongs to at most one of them.
 */
@Value
public class FinancialPeriod {
    UUID id;
    String periodName;
    PeriodType periodType;
    LocalDate startDate;
    LocalDate endDate;
    PeriodStatus status;
    boolean adjustmentPeriod;
    String closedBy;
    Instant closedAt;

    public static FinancialPeriod open(String periodName, PeriodType periodType,
                                       LocalDate startDate, LocalDate endDate, boolean adjustmentPeriod) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                String.format("Period start %s is after end %s", startDate, endDate));
        }
        return new FinancialPeriod(UUID.randomUUID(), periodName, periodType, startDate, endDate,
            PeriodStatus.OPEN, adjustmentPeriod, null, null);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isOpen() {
        return status == PeriodStatus.OPEN;
    }

    public FinancialPeriod close(String user) {
        requireTransition(PeriodStatus.CLOSED);
        return new FinancialPeriod(id, periodName, periodType, startDate, endDate,
            PeriodStatus.CLOSED, adjustmentPeriod, user, Instant.now());
    }

    public FinancialPeriod lock() {
        requireTransition(PeriodStatus.LOCKED);
        return new FinancialPeriod(id, periodName, periodType, startDate, endDate,
            PeriodStatus.LOCKED, adjustmentPeriod, closedBy, closedAt);
    }

    public FinancialPeriod reopen() {
        requireTransition(PeriodStatus.OPEN);
        return new FinancialPeriod(id, periodName, periodType, startDate, endDate,
            PeriodStatus.OPEN, adjustmentPeriod, null, null);
    }

    private void requireTransition(PeriodStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move period %s from %s to %s", periodName, status, target));
        }
    }
}
