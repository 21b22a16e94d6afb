package com.flagship.accounting.ledger;

import java.math.BigDecimal;

/**
 * Top-level classification of an account and its normal balance.
 *
 * ASSET and EXPENSE increase on debit; LIABILITY, EQUITY and REVENUE increase on credit.
 */
public enum AccountType {
    ASSET(EntryType.DEBIT),
    LIABILITY(EntryType.CREDIT),
    EQUITY(EntryType.CREDIT),
    REVENUE(EntryType.CREDIT),
    EXPENSE(EntryType.DEBIT);

    private final EntryType normalSide;

    AccountType(EntryType normalSide) {
        this.normalSide = normalSide;
    }

    public EntryType getNormalSide() {
        return normalSide;
    }

    /**
     * Change to the account balance caused by one line.
     */
    public BigDecimal signedDelta(BigDecimal debit, BigDecimal credit) {
        return normalSide == EntryType.DEBIT
            ? debit.subtract(credit)
            : credit.subtract(debit);
    }
}
