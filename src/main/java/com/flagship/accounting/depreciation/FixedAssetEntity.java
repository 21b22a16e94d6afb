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
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "fixed_assets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FixedAssetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "asset_code", nullable = false, updatable = false, unique = true)
    private String assetCode;

    @Column(nullable = false)
    private String name;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "acquisition_date", nullable = false, updatable = false)
    private LocalDate acquisitionDate;

    @Column(name = "capitalized_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal capitalizedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method")
    private DepreciationMethod methodOverride;

    @Column(name = "depreciation_rate", precision = 7, scale = 4)
    private BigDecimal rateOverride;

    @Column(name = "salvage_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal salvageValue;

    @Column(name = "accumulated_depreciation", nullable = false, precision = 19, scale = 4)
    private BigDecimal accumulatedDepreciation;

    @Column(name = "current_book_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal currentBookValue;

    @Column(name = "last_depreciation_date")
    private LocalDate lastDepreciationDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AssetStatus status;

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

    static FixedAssetEntity fromDomain(FixedAsset asset) {
        return new FixedAssetEntity(
            asset.getId(),
            asset.getAssetCode(),
            asset.getName(),
            asset.getCategoryId(),
            asset.getAcquisitionDate(),
            asset.getCapitalizedValue(),
            asset.getMethodOverride(),
            asset.getRateOverride(),
            asset.getSalvageValue(),
            asset.getAccumulatedDepreciation(),
            asset.getCurrentBookValue(),
            asset.getLastDepreciationDate(),
            asset.getStatus(),
            null,
            null
        );
    }

    public FixedAsset toDomain() {
        return new FixedAsset(id, assetCode, name, categoryId, acquisitionDate, capitalizedValue,
            methodOverride, rateOverride, salvageValue, accumulatedDepreciation, currentBookValue,
            lastDepreciationDate, status);
    }

    void updateFromDomain(FixedAsset asset) {
        this.name = asset.getName();
        this.accumulatedDepreciation = asset.getAccumulatedDepreciation();
        this.currentBookValue = asset.getCurrentBookValue();
        this.lastDepreciationDate = asset.getLastDepreciationDate();
        this.status = asset.getStatus();
    }
}
