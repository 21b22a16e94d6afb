package com.flagship.accounting.ledger;

/**
 * Finer classification used by the balance sheet and profit and loss groupings.
 */
public enum AccountSubType {
    CURRENT_ASSET(AccountType.ASSET),
    FIXED_ASSET(AccountType.ASSET),
    BANK(AccountType.ASSET),
    CASH(AccountType.ASSET),
    ACCOUNTS_RECEIVABLE(AccountType.ASSET),
    INVENTORY(AccountType.ASSET),
    PREPAID_EXPENSE(AccountType.ASSET),
    // contra-asset, carries a credit balance shown as negative
    ACCUMULATED_DEPRECIATION(AccountType.ASSET),

    CURRENT_LIABILITY(AccountType.LIABILITY),
    LONG_TERM_LIABILITY(AccountType.LIABILITY),
    ACCOUNTS_PAYABLE(AccountType.LIABILITY),
    TAX_PAYABLE(AccountType.LIABILITY),

    SHARE_CAPITAL(AccountType.EQUITY),
    RETAINED_EARNINGS(AccountType.EQUITY),
    RESERVES(AccountType.EQUITY),

    SALES_REVENUE(AccountType.REVENUE),
    SERVICE_REVENUE(AccountType.REVENUE),
    OTHER_INCOME(AccountType.REVENUE),

    COST_OF_GOODS(AccountType.EXPENSE),
    OPERATING_EXPENSE(AccountType.EXPENSE),
    ADMINISTRATIVE_EXPENSE(AccountType.EXPENSE),
    SELLING_EXPENSE(AccountType.EXPENSE),
    DEPRECIATION_EXPENSE(AccountType.EXPENSE),
    TAX_EXPENSE(AccountType.EXPENSE);

    private final AccountType accountType;

    AccountSubType(AccountType accountType) {
        this.accountType = accountType;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
