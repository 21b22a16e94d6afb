package com.flagship.accounting.depreciation;

/**
 * Only ACTIVE assets are depreciated. DISPOSED, WRITTEN_OFF and TRANSFERRED are final.
 */
public enum AssetStatus {
    ACTIVE,
    UNDER_MAINTENANCE,
    DISPOSED,
    WRITTEN_OFF,
    TRANSFERRED;

    public boolean isFinal() {
        return this == DISPOSED || this == WRITTEN_OFF || this == TRANSFERRED;
    }

    public boolean canTransitionTo(AssetStatus target) {
        return !isFinal() && target != this;
    }
}
