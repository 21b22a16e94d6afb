package com.flagship.accounting.exception;

import lombok.Getter;

/**
 * Base type for every typed failure of the accounting core.
 *
 * A failure is always local to the call that raised it: the surrounding
 * transaction rolls back and nothing is partially committed.
 */
@Getter
public abstract class AccountingException extends RuntimeException {

    private final FailureKind kind;

    protected AccountingException(FailureKind kind, FailureKind.Category expected, String message) {
        super(message);
        if (kind.getCategory() != expected) {
            throw new IllegalArgumentException(
                String.format("Failure kind %s belongs to %s, not %s", kind, kind.getCategory(), expected));
        }
        this.kind = kind;
    }
}
