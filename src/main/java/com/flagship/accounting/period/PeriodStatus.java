package com.flagship.accounting.period;

/**
 * Lifecycle of a financial period: OPEN accepts postings, CLOSED can still be reopened, LOCKED is final.
 */
public enum PeriodStatus {
    OPEN,
    CLOSED,
    LOCKED;

    public boolean canTransitionTo(PeriodStatus target) {
        return switch (this) {
            case OPEN -> target == CLOSED;
            case CLOSED -> target == OPEN || target == LOCKED;
            case LOCKED -> false;
        };
    }
}
