package com.flagship.accounting.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class UpdateAccountRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("allow_direct_posting")
    boolean allowDirectPosting;
}
