package com.flagship.accounting.exception;

import java.util.UUID;

/**
 * An account, period, cost center or document id that does not resolve.
 */
public class ReferenceNotFoundException extends AccountingException {

    public ReferenceNotFoundException(FailureKind kind, String message) {
        super(kind, FailureKind.Category.REFERENCE, message);
    }

    public static ReferenceNotFoundException of(FailureKind kind, String what, UUID id) {
        return new ReferenceNotFoundException(kind, what + " not found: " + id);
    }
}
