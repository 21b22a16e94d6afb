package com.flagship.accounting.ledger;

import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.PeriodCloseGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Draft journal entries dated inside a period keep it open.
 */
@Component
@RequiredArgsConstructor
class JournalEntryCloseGuard implements PeriodCloseGuard {

    private final JournalEntryRepository journalEntryRepository;

    @Override
    public long countBlockingDocuments(FinancialPeriod period) {
        return journalEntryRepository.countDraftsBetween(period.getStartDate(), period.getEndDate());
    }

    @Override
    public String documentLabel() {
        return "draft journal entries";
    }
}
