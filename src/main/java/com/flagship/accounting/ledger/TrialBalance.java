package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class TrialBalance {
    LocalDate asOf;
    List<Line> lines;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    boolean balanced;

    /**
     * One account's balance placed on its debit or credit column.
     */
    @Value
    public static class Line {
        UUID accountId;
        String accountCode;
        String accountName;
        AccountType accountType;
        BigDecimal debit;
        BigDecimal credit;
    }
}
