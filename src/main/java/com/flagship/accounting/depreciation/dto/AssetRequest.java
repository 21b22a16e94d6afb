package com.flagship.accounting.depreciation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.depreciation.DepreciationMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class AssetRequest {

    @NotBlank(message = "Asset code is required")
    @JsonProperty("asset_code")
    String assetCode;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Category ID is required")
    @JsonProperty("category_id")
    UUID categoryId;

    @NotNull(message = "Acquisition date is required")
    @JsonProperty("acquisition_date")
    LocalDate acquisitionDate;

    @NotNull(message = "Capitalized value is required")
    @DecimalMin(value = "0.01", message = "Capitalized value must be greater than 0")
    @JsonProperty("capitalized_value")
    BigDecimal capitalizedValue;

    @JsonProperty("depreciation_method")
    DepreciationMethod depreciationMethod;

    @JsonProperty("depreciation_rate")
    BigDecimal depreciationRate;

    @JsonProperty("salvage_value")
    BigDecimal salvageValue;
}
