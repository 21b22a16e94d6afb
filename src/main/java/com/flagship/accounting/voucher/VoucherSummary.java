package com.flagship.accounting.voucher;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Voucher counts and totals over a date range, broken down by status and by type.
 */
@Value
public class VoucherSummary {
    LocalDate from;
    LocalDate to;
    long totalCount;
    Map<VoucherStatus, Bucket> byStatus;
    Map<VoucherType, Bucket> byType;

    @Value
    public static class Bucket {
        long count;
        BigDecimal amount;

        Bucket plus(long moreCount, BigDecimal moreAmount) {
            return new Bucket(count + moreCount, amount.add(moreAmount));
        }
    }
}
