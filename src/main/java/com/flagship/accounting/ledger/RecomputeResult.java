package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of refolding an account's ledger rows.
 * {@code rowsRewritten} counts rows whose running balance changed.
 */
@Value
public class RecomputeResult {
    UUID accountId;
    BigDecimal previousBalance;
    BigDecimal recomputedBalance;
    int rowsFolded;
    int rowsRewritten;
    boolean balanceChanged;
}
