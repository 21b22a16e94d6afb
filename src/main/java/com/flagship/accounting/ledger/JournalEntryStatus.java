package com.flagship.accounting.ledger;

/**
 * Journal entry lifecycle.
 *
 * A reversed entry stays POSTED with its reversed flag set; history is never rewritten.
 * REVERSED is accepted for imported history and is never assigned by the engine.
 */
public enum JournalEntryStatus {
    DRAFT,
    POSTED,
    REVERSED,
    CANCELLED;

    public boolean canTransitionTo(JournalEntryStatus target) {
        return switch (this) {
            case DRAFT -> target == POSTED || target == CANCELLED;
            case POSTED, REVERSED, CANCELLED -> false;
        };
    }
}
