package com.flagship.accounting.costcenter;

import com.flagship.accounting.costcenter.dto.CostCenterRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/cost-centers")
@RequiredArgsConstructor
public class CostCenterController {

    private final CostCenterService costCenterService;

    @PostMapping
    public ResponseEntity<CostCenter> create(@Valid @RequestBody CostCenterRequest request) {
        CostCenter costCenter = costCenterService.create(request.getCode(), request.getName(),
            request.getParentId(), request.getCenterType(), request.getAnnualBudget());
        return ResponseEntity.status(HttpStatus.CREATED).body(costCenter);
    }

    @GetMapping
    public List<CostCenter> list() {
        return costCenterService.list();
    }

    @GetMapping("/{id}")
    public CostCenter get(@PathVariable("id") UUID id) {
        return costCenterService.findById(id);
    }

    @PutMapping("/{id}")
    public CostCenter update(@PathVariable("id") UUID id, @Valid @RequestBody CostCenterRequest request) {
        return costCenterService.update(id, request.getName(), request.getAnnualBudget());
    }

    @PostMapping("/{id}/deactivate")
    public CostCenter deactivate(@PathVariable("id") UUID id) {
        return costCenterService.deactivate(id);
    }

    @GetMapping("/{id}/utilization")
    public BudgetUtilization utilization(
            @PathVariable("id") UUID id,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return costCenterService.budgetUtilization(id, from, to);
    }
}
