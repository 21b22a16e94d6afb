package com.flagship.accounting.exception;

/**
 * The current state of a period, entry or voucher does not allow the requested call.
 */
public class StateConflictException extends AccountingException {

    public StateConflictException(FailureKind kind, String message) {
        super(kind, FailureKind.Category.STATE_CONFLICT, message);
    }
}
