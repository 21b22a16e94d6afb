package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Balances by sub-type as of a date. Unclosed profit is carried inside equity.
 */
@Value
public class BalanceSheet {
    LocalDate asOf;
    Map<AccountSubType, BigDecimal> assets;
    Map<AccountSubType, BigDecimal> liabilities;
    Map<AccountSubType, BigDecimal> equity;
    BigDecimal currentProfit;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    BigDecimal totalEquity;

    public boolean isBalanced() {
        return totalAssets.compareTo(totalLiabilities.add(totalEquity)) == 0;
    }
}
