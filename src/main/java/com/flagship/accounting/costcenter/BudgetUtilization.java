package com.flagship.accounting.costcenter;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Spend against a cost center's annual budget. {@code utilizationPercent} is null when no budget is set.
 */
@Value
public class BudgetUtilization {
    UUID costCenterId;
    String code;
    LocalDate from;
    LocalDate to;
    BigDecimal budget;
    BigDecimal spend;
    BigDecimal remaining;
    BigDecimal utilizationPercent;
}
