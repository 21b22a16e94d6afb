package com.flagship.accounting.depreciation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A capitalized asset.
 *
 * Invariants: {@code currentBookValue = capitalizedValue - accumulatedDepreciation}
 * and {@code currentBookValue >= salvageValue}. Immutable; {@link #depreciate} returns a new instance.
 */
@Value
public class FixedAsset {
    UUID id;
    String assetCode;
    String name;
    UUID categoryId;
    LocalDate acquisitionDate;
    BigDecimal capitalizedValue;
    DepreciationMethod methodOverride;
    BigDecimal rateOverride;
    BigDecimal salvageValue;
    BigDecimal accumulatedDepreciation;
    BigDecimal currentBookValue;
    LocalDate lastDepreciationDate;
    AssetStatus status;

    public static FixedAsset register(String assetCode, String name, UUID categoryId, LocalDate acquisitionDate,
                                      BigDecimal capitalizedValue, DepreciationMethod methodOverride,
                                      BigDecimal rateOverride, BigDecimal salvageValue) {
        if (capitalizedValue == null || capitalizedValue.signum() <= 0) {
            throw new IllegalArgumentException("Capitalized value must be positive");
        }
        BigDecimal salvage = salvageValue != null ? salvageValue : BigDecimal.ZERO;
        if (salvage.signum() < 0 || salvage.compareTo(capitalizedValue) > 0) {
            throw new IllegalArgumentException("Salvage value must be between zero and the capitalized value");
        }
        return new FixedAsset(UUID.randomUUID(), assetCode, name, categoryId, acquisitionDate,
            capitalizedValue, methodOverride, rateOverride, salvage,
            BigDecimal.ZERO, capitalizedValue, null, AssetStatus.ACTIVE);
    }

    public DepreciationMethod effectiveMethod(AssetCategory category) {
        return methodOverride != null ? methodOverride : category.getDepreciationMethod();
    }

    public BigDecimal effectiveRate(AssetCategory category) {
        return rateOverride != null ? rateOverride : category.getDepreciationRate();
    }

    public boolean isFullyDepreciated() {
        return currentBookValue.compareTo(salvageValue) <= 0;
    }

    public FixedAsset depreciate(BigDecimal amount, LocalDate periodDate) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Depreciation amount must be positive");
        }
        BigDecimal closing = currentBookValue.subtract(amount);
        if (closing.compareTo(salvageValue) < 0) {
            throw new IllegalStateException(String.format(
                "Depreciation of %s would take asset %s below salvage value %s", amount, assetCode, salvageValue));
        }
        return new FixedAsset(id, assetCode, name, categoryId, acquisitionDate, capitalizedValue,
            methodOverride, rateOverride, salvageValue,
            accumulatedDepreciation.add(amount), closing, periodDate, status);
    }

    public FixedAsset withStatus(AssetStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Cannot move asset %s from %s to %s", assetCode, status, newStatus));
        }
        return new FixedAsset(id, assetCode, name, categoryId, acquisitionDate, capitalizedValue,
            methodOverride, rateOverride, salvageValue,
            accumulatedDepreciation, currentBookValue, lastDepreciationDate, newStatus);
    }
}
