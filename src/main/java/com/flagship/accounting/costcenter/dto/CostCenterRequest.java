package com.flagship.accounting.costcenter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.costcenter.CostCenterType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Create body. On update only {@code name} and {@code annual_budget} are read.
 */
@Value
public class CostCenterRequest {

    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("center_type")
    CostCenterType centerType;

    @DecimalMin(value = "0", message = "Annual budget cannot be negative")
    @JsonProperty("annual_budget")
    BigDecimal annualBudget;
}
