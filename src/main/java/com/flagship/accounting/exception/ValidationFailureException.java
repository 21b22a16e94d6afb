package com.flagship.accounting.exception;

/**
 * Input rejected before any write (imbalanced entry, zero amount, missing field).
 */
public class ValidationFailureException extends AccountingException {

    public ValidationFailureException(FailureKind kind, String message) {
        super(kind, FailureKind.Category.VALIDATION, message);
    }
}
