package com.flagship.accounting.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @JsonProperty("account_code")
    String accountCode;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @NotNull(message = "Sub-type is required")
    @JsonProperty("sub_type")
    AccountSubType subType;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("is_group")
    boolean group;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("allow_direct_posting")
    Boolean allowDirectPosting;

    @JsonProperty("description")
    String description;
}
