package com.flagship.accounting.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class ReversalRequest {

    @NotNull(message = "Reversal date is required")
    @JsonProperty("reversal_date")
    LocalDate reversalDate;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
