package com.flagship.accounting.depreciation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Monthly depreciation arithmetic. No I/O, no state.
 */
public final class DepreciationCalculator {

    private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private DepreciationCalculator() {
    }

    /**
     * One month's charge, rounded to 2 places and clamped so the book value never
     * falls below salvage. Zero means the asset has nothing left to depreciate.
     *
     * SLM charges {@code (capitalized - salvage) x rate/100/12} every month;
     * WDV charges {@code bookValue x rate/100/12}.
     */
    public static BigDecimal monthlyAmount(DepreciationMethod method, BigDecimal rate,
                                           BigDecimal capitalizedValue, BigDecimal bookValue,
                                           BigDecimal salvageValue) {
        if (method == null || rate == null) {
            throw new IllegalArgumentException("Depreciation method and rate are required");
        }
        if (rate.signum() < 0) {
            throw new IllegalArgumentException("Depreciation rate cannot be negative: " + rate);
        }
        BigDecimal salvage = salvageValue != null ? salvageValue : BigDecimal.ZERO;
        BigDecimal base = switch (method) {
            case SLM -> capitalizedValue.subtract(salvage);
            case WDV -> bookValue;
        };
        BigDecimal amount = base.multiply(rate)
            .divide(HUNDRED.multiply(MONTHS_PER_YEAR), 2, RoundingMode.HALF_UP);

        BigDecimal remaining = bookValue.subtract(salvage);
        if (bookValue.subtract(amount).compareTo(salvage) < 0) {
            amount = remaining;
        }
        return amount.signum() > 0 ? amount : BigDecimal.ZERO;
    }

    /**
     * April to March, written {@code 2024-25}.
     */
    public static String financialYear(LocalDate date) {
        int startYear = date.getMonthValue() >= 4 ? date.getYear() : date.getYear() - 1;
        return String.format("%d-%02d", startYear, (startYear + 1) % 100);
    }

    /** Run dates are normalized to the last day of their month. */
    public static LocalDate periodEnd(LocalDate date) {
        return YearMonth.from(date).atEndOfMonth();
    }

    static String monthLabel(LocalDate date) {
        return MONTH_YEAR.format(date);
    }
}
