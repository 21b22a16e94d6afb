package com.flagship.accounting.ledger;

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

/**
 * JPA mapping of {@link Account}.
 *
 * No setters. The balance mutator is package-private so that only the
 * journal engine and the ledger projector, both in this package, can move it.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_code", nullable = false, updatable = false, unique = true)
    private String accountCode;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false)
    private AccountType accountType;

    @Enumerated(EnumType.STRING)
    @Column(name = "sub_type", nullable = false, updatable = false)
    private AccountSubType subType;

    @Column(name = "parent_id", updatable = false)
    private UUID parentId;

    @Column(nullable = false, updatable = false)
    private int level;

    @Column(name = "is_group", nullable = false, updatable = false)
    private boolean group;

    @Column(name = "opening_balance", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal openingBalance;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal currentBalance;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "allow_direct_posting", nullable = false)
    private boolean allowDirectPosting;

    @Column
    private String description;

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

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getAccountCode(),
            account.getName(),
            account.getAccountType(),
            account.getSubType(),
            account.getParentId(),
            account.getLevel(),
            account.isGroup(),
            account.getOpeningBalance(),
            account.getCurrentBalance(),
            account.isActive(),
            account.isAllowDirectPosting(),
            account.getDescription(),
            null,
            null
        );
    }

    public Account toDomain() {
        return new Account(id, accountCode, name, accountType, subType, parentId, level, group,
            openingBalance, currentBalance, active, allowDirectPosting, description);
    }

    void updateDetails(String name, String description, boolean allowDirectPosting) {
        this.name = name;
        this.description = description;
        this.allowDirectPosting = allowDirectPosting;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    /**
     * Applies a signed delta and returns the new balance.
     */
    BigDecimal applyDelta(BigDecimal delta) {
        this.currentBalance = this.currentBalance.add(delta);
        return this.currentBalance;
    }

    void resetBalance(BigDecimal balance) {
        this.currentBalance = balance;
    }
}
