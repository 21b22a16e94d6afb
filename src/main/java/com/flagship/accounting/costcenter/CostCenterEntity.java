package com.flagship.accounting.costcenter;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cost_centers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CostCenterEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(name = "parent_id", updatable = false)
    private UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "center_type", nullable = false, updatable = false)
    private CostCenterType centerType;

    @Column(name = "annual_budget", precision = 19, scale = 4)
    private BigDecimal annualBudget;

    @Column(name = "is_active", nullable = false)
    private boolean active;

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

    static CostCenterEntity fromDomain(CostCenter costCenter) {
        return new CostCenterEntity(
            costCenter.getId(),
            costCenter.getCode(),
            costCenter.getName(),
            costCenter.getParentId(),
            costCenter.getCenterType(),
            costCenter.getAnnualBudget(),
            costCenter.isActive(),
            null,
            null
        );
    }

    public CostCenter toDomain() {
        return new CostCenter(id, code, name, parentId, centerType, annualBudget, active);
    }

    void updateDetails(String name, BigDecimal annualBudget) {
        this.name = name;
        this.annualBudget = annualBudget;
    }

    void deactivate() {
        this.active = false;
    }
}
