package com.flagship.accounting.voucher;

/**
 * Document kinds a payment, receipt or note can settle.
 */
public enum AllocationSourceType {
    TAX_INVOICE,
    VENDOR_INVOICE,
    CREDIT_NOTE,
    DEBIT_NOTE,
    PURCHASE_ORDER
}
