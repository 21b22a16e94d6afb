package com.flagship.accounting.period;

import com.flagship.accounting.event.PeriodClosedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Financial period calendar.
 *
 * Periods never overlap (checked here and by an exclusion constraint in the schema).
 * Closing is a hard gate: every registered {@link PeriodCloseGuard} must report
 * zero unfinished documents inside the period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialPeriodService {

    private static final String AGGREGATE_TYPE = "FinancialPeriod";

    private final FinancialPeriodRepository repository;
    private final List<PeriodCloseGuard> closeGuards;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;

    @Transactional
    public FinancialPeriod createPeriod(String periodName, PeriodType periodType,
                                        LocalDate startDate, LocalDate endDate, boolean adjustmentPeriod) {
        if (periodName == null || periodName.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Period name is required");
        }
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw new ValidationFailureException(FailureKind.INVALID_PERIOD_RANGE,
                String.format("Invalid period range: %s to %s", startDate, endDate));
        }
        if (repository.existsByPeriodName(periodName)) {
            throw new ValidationFailureException(FailureKind.DUPLICATE_CODE,
                "Period name already exists: " + periodName);
        }
        long overlapping = repository.countOverlapping(startDate, endDate);
        if (overlapping > 0) {
            throw new StateConflictException(FailureKind.PERIOD_OVERLAP,
                String.format("Period %s to %s overlaps %d existing period(s)", startDate, endDate, overlapping));
        }

        FinancialPeriod period = FinancialPeriod.open(periodName, periodType, startDate, endDate, adjustmentPeriod);
        repository.save(FinancialPeriodEntity.fromDomain(period));
        log.info("Created financial period {} ({} to {})", periodName, startDate, endDate);
        return period;
    }

    /**
     * Resolves the single OPEN period containing {@code date} and holds a shared lock on it
     * for the rest of the caller's transaction.
     *
     * @throws StateConflictException NO_OPEN_PERIOD when no OPEN period contains the date
     */
    @Transactional
    public FinancialPeriod requireOpenPeriod(LocalDate date) {
        List<FinancialPeriodEntity> open = repository.findOpenContainingForShare(date);
        if (open.isEmpty()) {
            throw new StateConflictException(FailureKind.NO_OPEN_PERIOD,
                "No open financial period for date " + date);
        }
        if (open.size() > 1) {
            throw new IllegalStateException("More than one open period contains " + date);
        }
        return open.get(0).toDomain();
    }

    @Transactional(readOnly = true)
    public boolean hasOpenPeriod(LocalDate date) {
        return repository.existsOpenContaining(date);
    }

    @Transactional(readOnly = true)
    public FinancialPeriod findById(UUID periodId) {
        return repository.findById(periodId)
            .map(FinancialPeriodEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.PERIOD_NOT_FOUND, "Period", periodId));
    }

    @Transactional(readOnly = true)
    public List<FinancialPeriod> listPeriods() {
        return repository.findAllByOrderByStartDateAsc().stream()
            .map(FinancialPeriodEntity::toDomain)
            .toList();
    }

    /**
     * Closes an OPEN period. Fails with UNPOSTED_ENTRIES_IN_PERIOD, reporting the count,
     * if any journal entry or voucher dated inside the period is still unfinished.
     */
    @Transactional
    public FinancialPeriod closePeriod(UUID periodId, String user) {
        FinancialPeriodEntity entity = loadForUpdate(periodId);
        FinancialPeriod period = entity.toDomain();
        if (!period.isOpen()) {
            throw new StateConflictException(FailureKind.PERIOD_NOT_OPEN,
                String.format("Period %s is %s, only OPEN periods can be closed", period.getPeriodName(), period.getStatus()));
        }

        long blocking = 0;
        StringBuilder breakdown = new StringBuilder();
        for (PeriodCloseGuard guard : closeGuards) {
            long count = guard.countBlockingDocuments(period);
            if (count > 0) {
                blocking += count;
                if (breakdown.length() > 0) {
                    breakdown.append(", ");
                }
                breakdown.append(count).append(' ').append(guard.documentLabel());
            }
        }
        if (blocking > 0) {
            throw new StateConflictException(FailureKind.UNPOSTED_ENTRIES_IN_PERIOD,
                String.format("Cannot close period %s with %d unposted entries (%s)",
                    period.getPeriodName(), blocking, breakdown));
        }

        FinancialPeriod closed = period.close(user);
        entity.updateFromDomain(closed);
        repository.save(entity);
        outboxService.saveEvent(AGGREGATE_TYPE, closed.getId(),
            PeriodClosedEvent.EVENT_TYPE, PeriodClosedEvent.from(closed));
        metrics.recordPeriodClosed();

        log.info("Closed financial period {} by {}", closed.getPeriodName(), user);
        return closed;
    }

    @Transactional
    public FinancialPeriod lockPeriod(UUID periodId, String user) {
        FinancialPeriodEntity entity = loadForUpdate(periodId);
        FinancialPeriod period = entity.toDomain();
        if (!period.getStatus().canTransitionTo(PeriodStatus.LOCKED)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Period %s is %s, only CLOSED periods can be locked", period.getPeriodName(), period.getStatus()));
        }
        FinancialPeriod locked = period.lock();
        entity.updateFromDomain(locked);
        repository.save(entity);
        log.info("Locked financial period {} by {}", locked.getPeriodName(), user);
        return locked;
    }

    @Transactional
    public FinancialPeriod reopenPeriod(UUID periodId, String user) {
        FinancialPeriodEntity entity = loadForUpdate(periodId);
        FinancialPeriod period = entity.toDomain();
        if (!period.getStatus().canTransitionTo(PeriodStatus.OPEN)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Period %s is %s and cannot be reopened", period.getPeriodName(), period.getStatus()));
        }
        FinancialPeriod reopened = period.reopen();
        entity.updateFromDomain(reopened);
        repository.save(entity);
        log.info("Reopened financial period {} by {}", reopened.getPeriodName(), user);
        return reopened;
    }

    private FinancialPeriodEntity loadForUpdate(UUID periodId) {
        return repository.findByIdForUpdate(periodId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.PERIOD_NOT_FOUND, "Period", periodId));
    }
}
