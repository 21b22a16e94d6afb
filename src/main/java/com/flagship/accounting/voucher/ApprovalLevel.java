package com.flagship.accounting.voucher;

import java.math.BigDecimal;

/**
 * Approval tier required for a voucher total. Both limits are inclusive upper bounds.
 */
public enum ApprovalLevel {
    LEVEL_1,
    LEVEL_2,
    LEVEL_3;

    public static ApprovalLevel forAmount(BigDecimal amount, BigDecimal level1Limit, BigDecimal level2Limit) {
        if (amount.compareTo(level1Limit) <= 0) {
            return LEVEL_1;
        }
        if (amount.compareTo(level2Limit) <= 0) {
            return LEVEL_2;
        }
        return LEVEL_3;
    }
}
