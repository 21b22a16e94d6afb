package com.flagship.accounting.depreciation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.depreciation.DepreciationMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CategoryRequest {

    @NotBlank(message = "Code is required")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Depreciation method is required")
    @JsonProperty("depreciation_method")
    DepreciationMethod depreciationMethod;

    @NotNull(message = "Depreciation rate is required")
    @JsonProperty("depreciation_rate")
    BigDecimal depreciationRate;

    @JsonProperty("useful_life_years")
    Integer usefulLifeYears;

    @JsonProperty("asset_account_id")
    UUID assetAccountId;

    @JsonProperty("accumulated_depreciation_account_id")
    UUID accumulatedDepreciationAccountId;

    @JsonProperty("depreciation_expense_account_id")
    UUID depreciationExpenseAccountId;
}
