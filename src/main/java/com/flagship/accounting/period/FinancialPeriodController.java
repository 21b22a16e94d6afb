package com.flagship.accounting.period;

import com.flagship.accounting.period.dto.CreatePeriodRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/periods")
@RequiredArgsConstructor
public class FinancialPeriodController {

    private static final String USER_HEADER = "X-User-Id";

    private final FinancialPeriodService periodService;

    @PostMapping
    public ResponseEntity<FinancialPeriod> createPeriod(@Valid @RequestBody CreatePeriodRequest request) {
        FinancialPeriod period = periodService.createPeriod(request.getPeriodName(), request.getPeriodType(),
            request.getStartDate(), request.getEndDate(), request.isAdjustmentPeriod());
        return ResponseEntity.status(HttpStatus.CREATED).body(period);
    }

    @GetMapping
    public List<FinancialPeriod> listPeriods() {
        return periodService.listPeriods();
    }

    @GetMapping("/{id}")
    public FinancialPeriod getPeriod(@PathVariable("id") UUID id) {
        return periodService.findById(id);
    }

    /**
     * 409 UNPOSTED_ENTRIES_IN_PERIOD, with the blocking count in the message, while drafts remain.
     */
    @PostMapping("/{id}/close")
    public FinancialPeriod closePeriod(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return periodService.closePeriod(id, user);
    }

    @PostMapping("/{id}/lock")
    public FinancialPeriod lockPeriod(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return periodService.lockPeriod(id, user);
    }

    @PostMapping("/{id}/reopen")
    public FinancialPeriod reopenPeriod(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return periodService.reopenPeriod(id, user);
    }
}
