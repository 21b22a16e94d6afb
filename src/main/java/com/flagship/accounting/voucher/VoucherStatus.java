package com.flagship.accounting.voucher;

/**
 * Voucher lifecycle.
 *
 * DRAFT -> PENDING_APPROVAL -> APPROVED -> POSTED, with REJECTED and CANCELLED as side exits.
 * A POSTED voucher is undone only by a reversal voucher; it never changes status again.
 */
public enum VoucherStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    REJECTED,
    POSTED,
    CANCELLED;

    public boolean canTransitionTo(VoucherStatus target) {
        return switch (this) {
            case DRAFT -> target == PENDING_APPROVAL || target == CANCELLED;
            case PENDING_APPROVAL -> target == APPROVED || target == REJECTED;
            case APPROVED -> target == POSTED;
            case REJECTED -> target == CANCELLED;
            case POSTED, CANCELLED -> false;
        };
    }

    /**
     * Still in flight: blocks closing of the period the voucher is dated in.
     */
    public boolean isUnfinished() {
        return this == DRAFT || this == PENDING_APPROVAL || this == APPROVED;
    }

    /**
     * Counts against a source document's outstanding amount.
     */
    public boolean isLive() {
        return this != CANCELLED && this != REJECTED;
    }
}
