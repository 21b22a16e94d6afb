package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JournalLine {
    UUID id;
    int lineNumber;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    UUID costCenterId;

    public PostingLine toPostingLine() {
        return PostingLine.of(accountId, debit, credit, description, costCenterId);
    }
}
