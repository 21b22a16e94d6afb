package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LedgerVerification {
    UUID accountId;
    BigDecimal storedBalance;
    BigDecimal foldedBalance;
    int mismatchedRows;

    public boolean isConsistent() {
        return mismatchedRows == 0 && storedBalance.compareTo(foldedBalance) == 0;
    }
}
