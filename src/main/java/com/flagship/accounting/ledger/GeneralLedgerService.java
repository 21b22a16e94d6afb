package com.flagship.accounting.ledger;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.ValidationFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the general ledger, plus the repair fold.
 *
 * Rows are folded in (transaction_date, sequence_number) order. Applying each row's
 * signed delta to the account's opening balance must reproduce both the stored
 * running balances and the account's current balance; {@link #recompute(UUID)}
 * rewrites them when it does not.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralLedgerService {

    private static final String LEDGER_COLUMNS =
        "g.id, g.sequence_number, g.account_id, g.period_id, g.transaction_date, g.journal_entry_id, " +
        "j.entry_number, g.journal_line_id, g.debit, g.credit, g.running_balance, g.narration, " +
        "g.cost_center_id, g.created_at";

    private final AccountRepository accountRepository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public AccountLedger ledger(UUID accountId, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Ledger range requires from and to dates");
        }
        if (from.isAfter(to)) {
            throw new ValidationFailureException(FailureKind.INVALID_PERIOD_RANGE,
                String.format("Ledger range start %s is after end %s", from, to));
        }
        Account account = loadAccount(accountId);

        BigDecimal[] before = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS debit, COALESCE(SUM(credit), 0) AS credit " +
            "FROM general_ledger WHERE account_id = ? AND transaction_date < ?",
            (rs, rowNum) -> new BigDecimal[] { rs.getBigDecimal("debit"), rs.getBigDecimal("credit") },
            accountId, from);
        BigDecimal openingBalance = account.getOpeningBalance()
            .add(account.getAccountType().signedDelta(before[0], before[1]));

        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + LEDGER_COLUMNS + " FROM general_ledger g " +
            "JOIN journal_entries j ON j.id = g.journal_entry_id " +
            "WHERE g.account_id = ? AND g.transaction_date BETWEEN ? AND ? " +
            "ORDER BY g.transaction_date, g.sequence_number",
            ledgerEntryRowMapper(),
            accountId, from, to);

        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            totalDebit = totalDebit.add(entry.getDebit());
            totalCredit = totalCredit.add(entry.getCredit());
        }
        BigDecimal closingBalance = openingBalance.add(account.getAccountType().signedDelta(totalDebit, totalCredit));
        return new AccountLedger(account, from, to, openingBalance, totalDebit, totalCredit, closingBalance, entries);
    }

    /**
     * Balances of active leaf accounts as of a date. Zero balances are omitted.
     */
    @Transactional(readOnly = true)
    public TrialBalance trialBalance(LocalDate asOf) {
        if (asOf == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Trial balance date is required");
        }
        List<TrialBalance.Line> lines = new ArrayList<>();
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;

        for (AccountBalance row : balancesAsOf(asOf, true)) {
            BigDecimal balance = row.balance();
            if (balance.signum() == 0) {
                continue;
            }
            boolean onNormalSide = balance.signum() > 0;
            boolean debitColumn = (row.accountType().getNormalSide() == EntryType.DEBIT) == onNormalSide;
            BigDecimal debit = debitColumn ? balance.abs() : BigDecimal.ZERO;
            BigDecimal credit = debitColumn ? BigDecimal.ZERO : balance.abs();
            lines.add(new TrialBalance.Line(row.accountId(), row.accountCode(), row.accountName(),
                row.accountType(), debit, credit));
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
        }
        return new TrialBalance(asOf, List.copyOf(lines), totalDebit, totalCredit,
            totalDebit.compareTo(totalCredit) == 0);
    }

    /**
     * Refolds an account's ledger rows from its opening balance and rewrites every
     * running balance and the current balance that disagrees with the fold.
     */
    @Transactional
    public RecomputeResult recompute(UUID accountId) {
        List<AccountEntity> locked = accountRepository.findAllByIdForUpdate(List.of(accountId));
        if (locked.isEmpty()) {
            throw ReferenceNotFoundException.of(FailureKind.ACCOUNT_NOT_FOUND, "Account", accountId);
        }
        AccountEntity account = locked.get(0);
        BigDecimal previousBalance = account.getCurrentBalance();

        List<FoldRow> rows = foldRows(accountId);
        BigDecimal balance = account.getOpeningBalance();
        List<Object[]> updates = new ArrayList<>();
        for (FoldRow row : rows) {
            balance = balance.add(account.getAccountType().signedDelta(row.debit(), row.credit()));
            if (row.runningBalance().compareTo(balance) != 0) {
                updates.add(new Object[] { balance, row.id() });
            }
        }
        if (!updates.isEmpty()) {
            jdbcTemplate.batchUpdate("UPDATE general_ledger SET running_balance = ? WHERE id = ?", updates);
        }

        boolean balanceChanged = previousBalance.compareTo(balance) != 0;
        if (balanceChanged) {
            account.resetBalance(balance);
            accountRepository.save(account);
        }
        if (balanceChanged || !updates.isEmpty()) {
            log.warn("Recomputed account {}: balance {} -> {}, {} of {} ledger rows rewritten",
                account.getAccountCode(), previousBalance, balance, updates.size(), rows.size());
        } else {
            log.info("Recomputed account {}: ledger consistent, {} rows folded", account.getAccountCode(), rows.size());
        }
        return new RecomputeResult(accountId, previousBalance, balance, rows.size(), updates.size(), balanceChanged);
    }

    /**
     * The same fold as {@link #recompute(UUID)}, without writing.
     */
    @Transactional(readOnly = true)
    public LedgerVerification verifyAccount(UUID accountId) {
        Account account = loadAccount(accountId);
        BigDecimal balance = account.getOpeningBalance();
        int mismatched = 0;
        for (FoldRow row : foldRows(accountId)) {
            balance = balance.add(account.getAccountType().signedDelta(row.debit(), row.credit()));
            if (row.runningBalance().compareTo(balance) != 0) {
                mismatched++;
            }
        }
        return new LedgerVerification(accountId, account.getCurrentBalance(), balance, mismatched);
    }

    @Transactional(readOnly = true)
    public BalanceSheet balanceSheet(LocalDate asOf) {
        if (asOf == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Balance sheet date is required");
        }
        Map<AccountSubType, BigDecimal> assets = new EnumMap<>(AccountSubType.class);
        Map<AccountSubType, BigDecimal> liabilities = new EnumMap<>(AccountSubType.class);
        Map<AccountSubType, BigDecimal> equity = new EnumMap<>(AccountSubType.class);
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;

        for (AccountBalance row : balancesAsOf(asOf, false)) {
            switch (row.accountType()) {
                case ASSET -> assets.merge(row.subType(), row.balance(), BigDecimal::add);
                case LIABILITY -> liabilities.merge(row.subType(), row.balance(), BigDecimal::add);
                case EQUITY -> equity.merge(row.subType(), row.balance(), BigDecimal::add);
                case REVENUE -> revenue = revenue.add(row.balance());
                case EXPENSE -> expenses = expenses.add(row.balance());
            }
        }
        BigDecimal currentProfit = revenue.subtract(expenses);
        BigDecimal totalEquity = sum(equity).add(currentProfit);
        return new BalanceSheet(asOf, assets, liabilities, equity, currentProfit,
            sum(assets), sum(liabilities), totalEquity);
    }

    @Transactional(readOnly = true)
    public ProfitAndLoss profitAndLoss(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Profit and loss requires from and to dates");
        }
        if (from.isAfter(to)) {
            throw new ValidationFailureException(FailureKind.INVALID_PERIOD_RANGE,
                String.format("Report start %s is after end %s", from, to));
        }
        Map<AccountSubType, BigDecimal> revenue = new EnumMap<>(AccountSubType.class);
        Map<AccountSubType, BigDecimal> expenses = new EnumMap<>(AccountSubType.class);

        jdbcTemplate.query(
            "SELECT a.account_type, a.sub_type, COALESCE(SUM(g.debit), 0) AS debit, " +
            "COALESCE(SUM(g.credit), 0) AS credit " +
            "FROM general_ledger g JOIN accounts a ON a.id = g.account_id " +
            "WHERE a.account_type IN ('REVENUE', 'EXPENSE') AND g.transaction_date BETWEEN ? AND ? " +
            "GROUP BY a.account_type, a.sub_type",
            rs -> {
                AccountType type = AccountType.valueOf(rs.getString("account_type"));
                AccountSubType subType = AccountSubType.valueOf(rs.getString("sub_type"));
                BigDecimal amount = type.signedDelta(rs.getBigDecimal("debit"), rs.getBigDecimal("credit"));
                (type == AccountType.REVENUE ? revenue : expenses).merge(subType, amount, BigDecimal::add);
            },
            from, to);

        BigDecimal totalRevenue = sum(revenue);
        BigDecimal totalExpenses = sum(expenses);
        BigDecimal grossProfit = totalRevenue.subtract(expenses.getOrDefault(AccountSubType.COST_OF_GOODS, BigDecimal.ZERO));
        return new ProfitAndLoss(from, to, revenue, expenses, totalRevenue, totalExpenses,
            grossProfit, totalRevenue.subtract(totalExpenses));
    }

    private List<AccountBalance> balancesAsOf(LocalDate asOf, boolean activeOnly) {
        return jdbcTemplate.query(
            "SELECT a.id, a.account_code, a.name, a.account_type, a.sub_type, a.opening_balance, " +
            "COALESCE(SUM(g.debit), 0) AS debit, COALESCE(SUM(g.credit), 0) AS credit " +
            "FROM accounts a " +
            "LEFT JOIN general_ledger g ON g.account_id = a.id AND g.transaction_date <= ? " +
            "WHERE a.is_group = FALSE" + (activeOnly ? " AND a.is_active = TRUE " : " ") +
            "GROUP BY a.id, a.account_code, a.name, a.account_type, a.sub_type, a.opening_balance " +
            "ORDER BY a.account_code",
            (rs, rowNum) -> {
                AccountType type = AccountType.valueOf(rs.getString("account_type"));
                BigDecimal balance = rs.getBigDecimal("opening_balance")
                    .add(type.signedDelta(rs.getBigDecimal("debit"), rs.getBigDecimal("credit")));
                return new AccountBalance(
                    rs.getObject("id", UUID.class),
                    rs.getString("account_code"),
                    rs.getString("name"),
                    type,
                    AccountSubType.valueOf(rs.getString("sub_type")),
                    balance);
            },
            asOf);
    }

    private List<FoldRow> foldRows(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, debit, credit, running_balance FROM general_ledger " +
            "WHERE account_id = ? ORDER BY transaction_date, sequence_number",
            (rs, rowNum) -> new FoldRow(
                rs.getObject("id", UUID.class),
                rs.getBigDecimal("debit"),
                rs.getBigDecimal("credit"),
                rs.getBigDecimal("running_balance")),
            accountId);
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ACCOUNT_NOT_FOUND, "Account", accountId));
    }

    private static BigDecimal sum(Map<AccountSubType, BigDecimal> amounts) {
        return amounts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getLong("sequence_number"),
            rs.getObject("account_id", UUID.class),
            rs.getObject("period_id", UUID.class),
            rs.getObject("transaction_date", LocalDate.class),
            rs.getObject("journal_entry_id", UUID.class),
            rs.getString("entry_number"),
            rs.getObject("journal_line_id", UUID.class),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getBigDecimal("running_balance"),
            rs.getString("narration"),
            rs.getObject("cost_center_id", UUID.class),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private record AccountBalance(UUID accountId, String accountCode, String accountName,
                                  AccountType accountType, AccountSubType subType, BigDecimal balance) {
    }

    private record FoldRow(UUID id, BigDecimal debit, BigDecimal credit, BigDecimal runningBalance) {
    }
}
