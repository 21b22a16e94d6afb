package com.flagship.accounting.exception;

/**
 * Closed set of failure reasons raised by the accounting core.
 * Each kind belongs to exactly one {@link Category}, which decides the exception type and HTTP status.
 */
public enum FailureKind {

    INVALID_BALANCE(Category.VALIDATION),
    ZERO_AMOUNT(Category.VALIDATION),
    MISSING_FIELD(Category.VALIDATION),
    INVALID_LINE(Category.VALIDATION),
    INVALID_ALLOCATION(Category.VALIDATION),
    INVALID_PERIOD_RANGE(Category.VALIDATION),
    DUPLICATE_CODE(Category.VALIDATION),
    INACTIVE_ACCOUNT(Category.VALIDATION),

    NO_OPEN_PERIOD(Category.STATE_CONFLICT),
    PERIOD_NOT_OPEN(Category.STATE_CONFLICT),
    PERIOD_OVERLAP(Category.STATE_CONFLICT),
    GROUP_ACCOUNT_POSTING(Category.STATE_CONFLICT),
    ALREADY_REVERSED(Category.STATE_CONFLICT),
    INVALID_TRANSITION(Category.STATE_CONFLICT),
    MAKER_CHECKER_VIOLATION(Category.STATE_CONFLICT),
    UNPOSTED_ENTRIES_IN_PERIOD(Category.STATE_CONFLICT),

    ACCOUNT_NOT_FOUND(Category.REFERENCE),
    PERIOD_NOT_FOUND(Category.REFERENCE),
    COST_CENTER_NOT_FOUND(Category.REFERENCE),
    JOURNAL_ENTRY_NOT_FOUND(Category.REFERENCE),
    VOUCHER_NOT_FOUND(Category.REFERENCE),
    ASSET_NOT_FOUND(Category.REFERENCE),
    CATEGORY_NOT_FOUND(Category.REFERENCE);

    public enum Category {
        /** Rejected before any write; retry after correcting the input. */
        VALIDATION,
        /** Current state forbids the call; re-fetch before retrying. */
        STATE_CONFLICT,
        /** An identifier does not resolve. */
        REFERENCE
    }

    private final Category category;

    FailureKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
