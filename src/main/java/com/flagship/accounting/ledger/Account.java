package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Chart of accounts node.
 *
 * Group accounts only aggregate their children; postings go to leaf accounts.
 * {@code currentBalance} is written exclusively by the journal engine.
 */
@Value
public class Account {
    UUID id;
    String accountCode;
    String name;
    AccountType accountType;
    AccountSubType subType;
    UUID parentId;
    int level;
    boolean group;
    BigDecimal openingBalance;
    BigDecimal currentBalance;
    boolean active;
    boolean allowDirectPosting;
    String description;

    public static Account create(String accountCode, String name, AccountSubType subType,
                                 Account parent, boolean group, BigDecimal openingBalance,
                                 boolean allowDirectPosting, String description) {
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;
        return new Account(
            UUID.randomUUID(),
            accountCode,
            name,
            subType.getAccountType(),
            subType,
            parent != null ? parent.getId() : null,
            parent != null ? parent.getLevel() + 1 : 1,
            group,
            opening,
            opening,
            true,
            allowDirectPosting,
            description
        );
    }

    /**
     * Leaf and active: the only accounts the journal engine accepts.
     */
    public boolean isPostable() {
        return active && !group;
    }
}
