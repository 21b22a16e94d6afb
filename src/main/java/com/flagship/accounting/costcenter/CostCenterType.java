package com.flagship.accounting.costcenter;

public enum CostCenterType {
    DEPARTMENT,
    BRANCH,
    PROJECT,
    PRODUCT
}
