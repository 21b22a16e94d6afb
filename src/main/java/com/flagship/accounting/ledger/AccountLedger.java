package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Ledger view of one account over a date range.
 */
@Value
public class AccountLedger {
    Account account;
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    BigDecimal closingBalance;
    List<LedgerEntry> entries;
}
