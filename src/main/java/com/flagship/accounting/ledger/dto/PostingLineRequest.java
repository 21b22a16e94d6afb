package com.flagship.accounting.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.ledger.PostingLine;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit or credit line as sent by clients. Shared by journal entries and vouchers.
 */
@Value
public class PostingLineRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("description")
    String description;

    @JsonProperty("cost_center_id")
    UUID costCenterId;

    public PostingLine toPostingLine() {
        return PostingLine.of(accountId, debit, credit, description, costCenterId);
    }
}
