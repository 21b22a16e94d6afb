package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@Value
public class ProfitAndLoss {
    LocalDate from;
    LocalDate to;
    Map<AccountSubType, BigDecimal> revenue;
    Map<AccountSubType, BigDecimal> expenses;
    BigDecimal totalRevenue;
    BigDecimal totalExpenses;
    BigDecimal grossProfit;
    BigDecimal netProfit;
}
