package com.flagship.accounting.voucher;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Part of a voucher applied against a source document.
 * {@code allocatedAmount + tdsAmount} is what the allocation consumes from the document's outstanding.
 */
@Value
public class VoucherAllocation {
    UUID id;
    AllocationSourceType sourceType;
    UUID sourceId;
    String sourceNumber;
    BigDecimal documentAmount;
    BigDecimal allocatedAmount;
    BigDecimal tdsAmount;

    public BigDecimal getConsumedAmount() {
        return allocatedAmount.add(tdsAmount);
    }
}
