package com.flagship.accounting.depreciation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Any day of the month to depreciate; {@code asset_ids} narrows the run, empty means all ACTIVE assets.
 */
@Value
public class DepreciationRunRequest {

    @NotNull(message = "Period date is required")
    @JsonProperty("period_date")
    LocalDate periodDate;

    @JsonProperty("asset_ids")
    List<UUID> assetIds;
}
