package com.flagship.accounting.costcenter;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Analytic tag carried by journal and voucher lines. Spend is derived from the ledger, never stored.
 */
@Value
public class CostCenter {
    UUID id;
    String code;
    String name;
    UUID parentId;
    CostCenterType centerType;
    BigDecimal annualBudget;
    boolean active;

    public static CostCenter create(String code, String name, UUID parentId,
                                    CostCenterType centerType, BigDecimal annualBudget) {
        return new CostCenter(UUID.randomUUID(), code, name, parentId, centerType, annualBudget, true);
    }
}
