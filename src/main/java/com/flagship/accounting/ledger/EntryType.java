package com.flagship.accounting.ledger;

/**
 * Side of a double-entry line.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
