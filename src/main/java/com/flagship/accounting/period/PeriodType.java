package com.flagship.accounting.period;

public enum PeriodType {
    MONTHLY,
    QUARTERLY,
    YEARLY
}
