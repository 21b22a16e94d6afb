package com.flagship.accounting.depreciation;

import com.flagship.accounting.depreciation.dto.DepreciationRunRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Trigger for the monthly batch. Scheduling is left to the caller.
 */
@RestController
@RequestMapping("/api/depreciation")
@RequiredArgsConstructor
public class DepreciationController {

    private static final String USER_HEADER = "X-User-Id";

    private final DepreciationService depreciationService;

    @PostMapping("/runs")
    public DepreciationRunResult run(@Valid @RequestBody DepreciationRunRequest request,
                                     @RequestHeader(USER_HEADER) String user) {
        return depreciationService.run(request.getPeriodDate(), request.getAssetIds(), user);
    }

    @PostMapping("/post-pending")
    public DepreciationRunResult postPending(
            @RequestParam("periodDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodDate,
            @RequestHeader(USER_HEADER) String user) {
        return depreciationService.postPending(periodDate, user);
    }
}
