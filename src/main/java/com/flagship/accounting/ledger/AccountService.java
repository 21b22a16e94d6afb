package com.flagship.accounting.ledger;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chart of accounts registry.
 *
 * Creates and classifies accounts. Never touches balances after creation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    @Transactional
    public Account createAccount(String accountCode, String name, AccountType accountType,
                                 AccountSubType subType, UUID parentId, boolean group,
                                 BigDecimal openingBalance, boolean allowDirectPosting, String description) {
        if (accountCode == null || accountCode.isBlank() || name == null || name.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Account code and name are required");
        }
        if (accountType == null || subType == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Account type and sub-type are required");
        }
        if (subType.getAccountType() != accountType) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                String.format("Sub-type %s does not belong to account type %s", subType, accountType));
        }
        if (accountRepository.existsByAccountCode(accountCode)) {
            throw new ValidationFailureException(FailureKind.DUPLICATE_CODE,
                "Account code already exists: " + accountCode);
        }
        if (group && openingBalance != null && openingBalance.signum() != 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                "Group account " + accountCode + " cannot carry an opening balance");
        }

        Account parent = null;
        if (parentId != null) {
            parent = findById(parentId);
            if (!parent.isGroup()) {
                throw new StateConflictException(FailureKind.GROUP_ACCOUNT_POSTING,
                    "Parent account " + parent.getAccountCode() + " is not a group account");
            }
            if (parent.getAccountType() != accountType) {
                throw new ValidationFailureException(FailureKind.INVALID_LINE,
                    String.format("Parent %s is %s, child cannot be %s",
                        parent.getAccountCode(), parent.getAccountType(), accountType));
            }
        }

        Account account = Account.create(accountCode, name, subType, parent, group,
            openingBalance, allowDirectPosting, description);
        accountRepository.save(AccountEntity.fromDomain(account));
        log.info("Created account {} {} ({}/{})", accountCode, name, accountType, subType);
        return account;
    }

    @Transactional
    public Account updateAccount(UUID accountId, String name, String description, boolean allowDirectPosting) {
        if (name == null || name.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Account name is required");
        }
        AccountEntity entity = load(accountId);
        entity.updateDetails(name, description, allowDirectPosting);
        return accountRepository.save(entity).toDomain();
    }

    @Transactional
    public Account deactivate(UUID accountId) {
        AccountEntity entity = load(accountId);
        if (entity.getCurrentBalance().signum() != 0) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Account %s has balance %s and cannot be deactivated",
                    entity.getAccountCode(), entity.getCurrentBalance()));
        }
        entity.setActive(false);
        log.info("Deactivated account {}", entity.getAccountCode());
        return accountRepository.save(entity).toDomain();
    }

    @Transactional
    public Account activate(UUID accountId) {
        AccountEntity entity = load(accountId);
        entity.setActive(true);
        return accountRepository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Account findById(UUID accountId) {
        return load(accountId).toDomain();
    }

    @Transactional(readOnly = true)
    public Account findByCode(String accountCode) {
        return accountRepository.findByAccountCode(accountCode)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new ReferenceNotFoundException(FailureKind.ACCOUNT_NOT_FOUND,
                "Account not found: " + accountCode));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountType type, boolean activeOnly) {
        List<AccountEntity> entities = type != null
            ? accountRepository.findByAccountTypeOrderByAccountCodeAsc(type)
            : accountRepository.findAllByOrderByAccountCodeAsc();
        return entities.stream()
            .filter(e -> !activeOnly || e.isActive())
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * Resolves the accounts a document wants to post to and checks each one is
     * active and a leaf. Used by callers that validate ahead of posting.
     */
    @Transactional(readOnly = true)
    public Map<UUID, Account> requirePostable(Collection<UUID> accountIds) {
        Map<UUID, Account> accounts = new HashMap<>();
        for (AccountEntity entity : accountRepository.findAllById(accountIds)) {
            accounts.put(entity.getId(), entity.toDomain());
        }
        for (UUID accountId : accountIds) {
            Account account = accounts.get(accountId);
            if (account == null) {
                throw ReferenceNotFoundException.of(FailureKind.ACCOUNT_NOT_FOUND, "Account", accountId);
            }
            checkPostable(account);
        }
        return accounts;
    }

    static void checkPostable(Account account) {
        if (account.isGroup()) {
            throw new StateConflictException(FailureKind.GROUP_ACCOUNT_POSTING,
                "Cannot post to group account " + account.getAccountCode());
        }
        if (!account.isActive()) {
            throw new ValidationFailureException(FailureKind.INACTIVE_ACCOUNT,
                "Account " + account.getAccountCode() + " is inactive");
        }
    }

    /**
     * Accounts arranged under their parents, ordered by code at every level.
     */
    @Transactional(readOnly = true)
    public List<AccountNode> accountTree() {
        Map<UUID, List<Account>> byParent = new HashMap<>();
        List<Account> roots = new ArrayList<>();
        for (AccountEntity entity : accountRepository.findAllByOrderByAccountCodeAsc()) {
            Account account = entity.toDomain();
            if (account.getParentId() == null) {
                roots.add(account);
            } else {
                byParent.computeIfAbsent(account.getParentId(), k -> new ArrayList<>()).add(account);
            }
        }
        return roots.stream()
            .sorted(Comparator.comparing(Account::getAccountCode))
            .map(root -> toNode(root, byParent))
            .toList();
    }

    private AccountNode toNode(Account account, Map<UUID, List<Account>> byParent) {
        List<AccountNode> children = byParent.getOrDefault(account.getId(), List.of()).stream()
            .map(child -> toNode(child, byParent))
            .toList();
        return new AccountNode(account, children);
    }

    private AccountEntity load(UUID accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ACCOUNT_NOT_FOUND, "Account", accountId));
    }

    @Value
    public static class AccountNode {
        Account account;
        List<AccountNode> children;
    }
}
