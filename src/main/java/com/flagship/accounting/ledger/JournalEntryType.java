package com.flagship.accounting.ledger;

public enum JournalEntryType {
    GENERAL,
    ADJUSTMENT,
    REVERSAL,
    DEPRECIATION,
    VOUCHER,
    OPENING
}
