package com.flagship.accounting.voucher;

public enum PaymentMode {
    CASH,
    CHEQUE,
    NEFT,
    RTGS,
    UPI,
    CARD,
    OTHER
}
