package com.flagship.accounting.costcenter;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.ValidationFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CostCenterService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final CostCenterRepository repository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public CostCenter create(String code, String name, UUID parentId,
                             CostCenterType centerType, BigDecimal annualBudget) {
        if (code == null || code.isBlank() || name == null || name.isBlank() || centerType == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Cost center code, name and type are required");
        }
        if (annualBudget != null && annualBudget.signum() < 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE, "Annual budget cannot be negative");
        }
        if (repository.existsByCode(code)) {
            throw new ValidationFailureException(FailureKind.DUPLICATE_CODE, "Cost center code already exists: " + code);
        }
        if (parentId != null && !repository.existsById(parentId)) {
            throw ReferenceNotFoundException.of(FailureKind.COST_CENTER_NOT_FOUND, "Parent cost center", parentId);
        }
        CostCenter costCenter = CostCenter.create(code, name, parentId, centerType, annualBudget);
        repository.save(CostCenterEntity.fromDomain(costCenter));
        log.info("Created cost center {} {} ({})", code, name, centerType);
        return costCenter;
    }

    @Transactional
    public CostCenter update(UUID id, String name, BigDecimal annualBudget) {
        if (name == null || name.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Cost center name is required");
        }
        CostCenterEntity entity = load(id);
        entity.updateDetails(name, annualBudget);
        repository.save(entity);
        return entity.toDomain();
    }

    @Transactional
    public CostCenter deactivate(UUID id) {
        CostCenterEntity entity = load(id);
        entity.deactivate();
        repository.save(entity);
        log.info("Deactivated cost center {}", entity.getCode());
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public CostCenter findById(UUID id) {
        return load(id).toDomain();
    }

    @Transactional(readOnly = true)
    public List<CostCenter> list() {
        return repository.findAllByOrderByCodeAsc().stream()
            .map(CostCenterEntity::toDomain)
            .toList();
    }

    /**
     * Fails unless every id names an active cost center.
     */
    @Transactional(readOnly = true)
    public void requireActive(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return;
        }
        Map<UUID, CostCenterEntity> found = repository.findAllById(ids).stream()
            .collect(Collectors.toMap(CostCenterEntity::getId, Function.identity()));
        for (UUID id : ids) {
            CostCenterEntity entity = found.get(id);
            if (entity == null || !entity.isActive()) {
                throw new ReferenceNotFoundException(FailureKind.COST_CENTER_NOT_FOUND,
                    "Cost center not found or inactive: " + id);
            }
        }
    }

    /**
     * Spend is the net debit of ledger rows tagged with the cost center inside the range.
     */
    @Transactional(readOnly = true)
    public BudgetUtilization budgetUtilization(UUID id, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Utilization requires from and to dates");
        }
        CostCenter costCenter = findById(id);
        BigDecimal spend = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit - credit), 0) FROM general_ledger " +
            "WHERE cost_center_id = ? AND transaction_date BETWEEN ? AND ?",
            BigDecimal.class,
            id, from, to);
        if (spend == null) {
            spend = BigDecimal.ZERO;
        }
        BigDecimal budget = costCenter.getAnnualBudget();
        BigDecimal remaining = budget != null ? budget.subtract(spend) : null;
        BigDecimal percent = budget != null && budget.signum() > 0
            ? spend.multiply(HUNDRED).divide(budget, 2, RoundingMode.HALF_UP)
            : null;
        return new BudgetUtilization(id, costCenter.getCode(), from, to, budget, spend, remaining, percent);
    }

    private CostCenterEntity load(UUID id) {
        return repository.findById(id)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.COST_CENTER_NOT_FOUND, "Cost center", id));
    }
}
