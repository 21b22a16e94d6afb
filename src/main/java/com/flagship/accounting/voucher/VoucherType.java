package com.flagship.accounting.voucher;

/**
 * Voucher kinds, with the number prefix and the header fields each one demands.
 */
public enum VoucherType {
    CONTRA("CTR", false, true, false),
    PAYMENT("PAY", true, true, true),
    RECEIPT("RCP", true, true, true),
    RCM_PAYMENT("RCM", true, false, false),
    JOURNAL("JNL", false, false, false),
    GST_SALE("GSL", true, false, false),
    SALES("SAL", true, false, true),
    PURCHASE("PUR", true, false, true),
    PURCHASE_RCM("PRM", true, false, false),
    CREDIT_NOTE("CRN", true, false, true),
    DEBIT_NOTE("DBN", true, false, true);

    private final String prefix;
    private final boolean requiresParty;
    private final boolean requiresBank;
    private final boolean supportsAllocation;

    VoucherType(String prefix, boolean requiresParty, boolean requiresBank, boolean supportsAllocation) {
        this.prefix = prefix;
        this.requiresParty = requiresParty;
        this.requiresBank = requiresBank;
        this.supportsAllocation = supportsAllocation;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean requiresParty() {
        return requiresParty;
    }

    public boolean requiresBank() {
        return requiresBank;
    }

    public boolean supportsAllocation() {
        return supportsAllocation;
    }
}
