package com.flagship.accounting.depreciation;

public enum DepreciationMethod {
    /** Straight-line: equal monthly charges over the depreciable base. */
    SLM,
    /** Written-down value: a fixed rate applied to the remaining book value. */
    WDV
}
