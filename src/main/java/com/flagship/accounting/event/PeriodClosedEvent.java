package com.flagship.accounting.event;

import com.flagship.accounting.period.FinancialPeriod;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class PeriodClosedEvent implements AccountingEvent {
    UUID eventId;
    UUID periodId;
    String periodName;
    LocalDate startDate;
    LocalDate endDate;
    String closedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PeriodClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return periodId;
    }

    public static PeriodClosedEvent from(FinancialPeriod period) {
        return new PeriodClosedEvent(UUID.randomUUID(), period.getId(), period.getPeriodName(),
            period.getStartDate(), period.getEndDate(), period.getClosedBy(), Instant.now());
    }
}
