package com.flagship.accounting.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.period.PeriodType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class CreatePeriodRequest {

    @NotBlank(message = "Period name is required")
    @JsonProperty("period_name")
    String periodName;

    @NotNull(message = "Period type is required")
    @JsonProperty("period_type")
    PeriodType periodType;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("is_adjustment_period")
    boolean adjustmentPeriod;
}
