package com.flagship.accounting.period;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of {@link FinancialPeriod}. Only the status columns change after creation.
 */
@Entity
@Table(name = "financial_periods")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FinancialPeriodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "period_name", nullable = false, updatable = false, unique = true)
    private String periodName;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, updatable = false)
    private PeriodType periodType;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PeriodStatus status;

    @Column(name = "is_adjustment_period", nullable = false, updatable = false)
    private boolean adjustmentPeriod;

    @Column(name = "closed_by")
    private String closedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FinancialPeriodEntity fromDomain(FinancialPeriod period) {
        return new FinancialPeriodEntity(
            period.getId(),
            period.getPeriodName(),
            period.getPeriodType(),
            period.getStartDate(),
            period.getEndDate(),
            period.getStatus(),
            period.isAdjustmentPeriod(),
            period.getClosedBy(),
            period.getClosedAt(),
            null,
            null
        );
    }

    public FinancialPeriod toDomain() {
        return new FinancialPeriod(id, periodName, periodType, startDate, endDate,
            status, adjustmentPeriod, closedBy, closedAt);
    }

    void updateFromDomain(FinancialPeriod period) {
        this.status = period.getStatus();
        this.closedBy = period.getClosedBy();
        this.closedAt = period.getClosedAt();
    }
}
