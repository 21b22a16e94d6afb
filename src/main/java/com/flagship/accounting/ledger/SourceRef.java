package com.flagship.accounting.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Business document that caused a journal entry (a voucher, a depreciation run, another entry).
 */
@Value
public class SourceRef {

    public static final String VOUCHER = "VOUCHER";
    public static final String DEPRECIATION = "DEPRECIATION";

    String sourceType;
    UUID sourceId;
    String sourceNumber;

    public static SourceRef of(String sourceType, UUID sourceId, String sourceNumber) {
        return new SourceRef(sourceType, sourceId, sourceNumber);
    }
}
