package com.flagship.accounting.voucher;

import com.flagship.accounting.ledger.PostingLine;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class VoucherLine {
    UUID id;
    int lineNumber;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    UUID costCenterId;

    static VoucherLine from(int lineNumber, PostingLine line) {
        return new VoucherLine(UUID.randomUUID(), lineNumber, line.getAccountId(), line.getDebit(),
            line.getCredit(), line.getDescription(), line.getCostCenterId());
    }

    public PostingLine toPostingLine() {
        return PostingLine.of(accountId, debit, credit, description, costCenterId);
    }
}
