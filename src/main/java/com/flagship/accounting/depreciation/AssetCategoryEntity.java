package com.flagship.accounting.depreciation;

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
@Table(name = "asset_categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssetCategoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true)
    private String code;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method", nullable = false)
    private DepreciationMethod depreciationMethod;

    @Column(name = "depreciation_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal depreciationRate;

    @Column(name = "useful_life_years")
    private Integer usefulLifeYears;

    @Column(name = "asset_account_id")
    private UUID assetAccountId;

    @Column(name = "accumulated_depreciation_account_id")
    private UUID accumulatedDepreciationAccountId;

    @Column(name = "depreciation_expense_account_id")
    private UUID depreciationExpenseAccountId;

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

    static AssetCategoryEntity fromDomain(AssetCategory category) {
        return new AssetCategoryEntity(
            category.getId(),
            category.getCode(),
            category.getName(),
            category.getDepreciationMethod(),
            category.getDepreciationRate(),
            category.getUsefulLifeYears(),
            category.getAssetAccountId(),
            category.getAccumulatedDepreciationAccountId(),
            category.getDepreciationExpenseAccountId(),
            category.isActive(),
            null,
            null
        );
    }

    public AssetCategory toDomain() {
        return new AssetCategory(id, code, name, depreciationMethod, depreciationRate, usefulLifeYears,
            assetAccountId, accumulatedDepreciationAccountId, depreciationExpenseAccountId, active);
    }
}
