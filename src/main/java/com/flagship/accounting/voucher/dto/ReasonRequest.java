package com.flagship.accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of reject and cancel.
 */
@Value
public class ReasonRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
