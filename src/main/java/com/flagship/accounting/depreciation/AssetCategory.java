package com.flagship.accounting.depreciation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Default depreciation policy and ledger accounts for a class of assets.
 */
@Value
public class AssetCategory {
    UUID id;
    String code;
    String name;
    DepreciationMethod depreciationMethod;
    BigDecimal depreciationRate;
    Integer usefulLifeYears;
    UUID assetAccountId;
    UUID accumulatedDepreciationAccountId;
    UUID depreciationExpenseAccountId;
    boolean active;

    public static AssetCategory create(String code, String name, DepreciationMethod method, BigDecimal rate,
                                       Integer usefulLifeYears, UUID assetAccountId,
                                       UUID accumulatedDepreciationAccountId, UUID depreciationExpenseAccountId) {
        return new AssetCategory(UUID.randomUUID(), code, name, method, rate, usefulLifeYears,
            assetAccountId, accumulatedDepreciationAccountId, depreciationExpenseAccountId, true);
    }

    /** Both sides of the depreciation posting are mapped. */
    public boolean canPost() {
        return accumulatedDepreciationAccountId != null && depreciationExpenseAccountId != null;
    }
}
