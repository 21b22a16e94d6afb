package com.flagship.accounting.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables of the accounting core, bound from the {@code accounting.*} namespace.
 */
@ConfigurationProperties(prefix = "accounting")
@Getter
@Setter
public class AccountingProperties {

    private Approval approval = new Approval();
    private Sequence sequence = new Sequence();
    private Depreciation depreciation = new Depreciation();
    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Approval {
        /** Inclusive upper bound of LEVEL_1. */
        private BigDecimal level1Limit = new BigDecimal("50000");
        /** Inclusive upper bound of LEVEL_2; anything above is LEVEL_3. */
        private BigDecimal level2Limit = new BigDecimal("500000");
    }

    @Getter
    @Setter
    public static class Sequence {
        private int counterWidth = 4;
    }

    @Getter
    @Setter
    public static class Depreciation {
        private UnpostedPolicy unpostedPolicy = UnpostedPolicy.COMPUTE_ONLY;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private Duration ttl = Duration.ofDays(7);
    }

    /**
     * What a depreciation run does for an asset that cannot be posted to the ledger
     * (category accounts missing, or no OPEN period for the run date).
     */
    public enum UnpostedPolicy {
        /** Record the entry unposted and move book value; post it later. */
        COMPUTE_ONLY,
        /** Leave the asset untouched and report it as skipped. */
        SKIP
    }
}
