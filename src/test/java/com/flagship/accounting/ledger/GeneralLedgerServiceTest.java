package com.flagship.accounting.ledger;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.support.AbstractIntegrationTest;
import com.flagship.accounting.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class GeneralLedgerServiceTest extends AbstractIntegrationTest {

    private static final YearMonth MAY = YearMonth.of(2024, 5);

    @Autowired
    private GeneralLedgerService generalLedgerService;

    @Autowired
    private LedgerFixtures fixtures;

    private Account bank;
    private Account capital;
    private Account sales;
    private Account rent;

    @BeforeEach
    void setUp() {
        fixtures.openMonth(MAY);
        bank = fixtures.leaf(AccountSubType.BANK);
        capital = fixtures.leaf(AccountSubType.SHARE_CAPITAL);
        sales = fixtures.leaf(AccountSubType.SALES_REVENUE);
        rent = fixtures.leaf(AccountSubType.OPERATING_EXPENSE);

        fixtures.post(MAY.atDay(1), bank, capital, "5000.00");
        fixtures.post(MAY.atDay(10), bank, sales, "1200.00");
        fixtures.post(MAY.atDay(20), rent, bank, "200.00");
    }

    @Test
    @DisplayName("Trial balance debits equal credits")
    void testTrialBalance() {
        TrialBalance trialBalance = generalLedgerService.trialBalance(MAY.atEndOfMonth());

        assertTrue(trialBalance.isBalanced());
        assertEquals(0, new BigDecimal("6200.00").compareTo(trialBalance.getTotalDebit()));
        assertEquals(0, new BigDecimal("6200.00").compareTo(trialBalance.getTotalCredit()));
        assertEquals(4, trialBalance.getLines().size());
    }

    @Test
    @DisplayName("Trial balance as of an earlier date ignores later postings")
    void testTrialBalance_AsOf() {
        TrialBalance trialBalance = generalLedgerService.trialBalance(MAY.atDay(5));

        assertTrue(trialBalance.isBalanced());
        assertEquals(0, new BigDecimal("5000.00").compareTo(trialBalance.getTotalDebit()));
    }

    @Test
    @DisplayName("Balance sheet balances with current profit in equity")
    void testBalanceSheet() {
        BalanceSheet sheet = generalLedgerService.balanceSheet(MAY.atEndOfMonth());

        assertTrue(sheet.isBalanced());
        assertEquals(0, new BigDecimal("6000.00").compareTo(sheet.getTotalAssets()));
        assertEquals(0, new BigDecimal("1000.00").compareTo(sheet.getCurrentProfit()));
        assertEquals(0, new BigDecimal("6000.00").compareTo(sheet.getTotalEquity()));
    }

    @Test
    @DisplayName("Profit and loss sums revenue and expenses in range")
    void testProfitAndLoss() {
        ProfitAndLoss pnl = generalLedgerService.profitAndLoss(MAY.atDay(1), MAY.atEndOfMonth());

        assertEquals(0, new BigDecimal("1200.00").compareTo(pnl.getTotalRevenue()));
        assertEquals(0, new BigDecimal("200.00").compareTo(pnl.getTotalExpenses()));
        assertEquals(0, new BigDecimal("1000.00").compareTo(pnl.getNetProfit()));

        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> generalLedgerService.profitAndLoss(MAY.atEndOfMonth(), MAY.atDay(1)));
        assertEquals(FailureKind.INVALID_PERIOD_RANGE, e.getKind());
    }

    @Test
    @DisplayName("Ledger view carries opening balance from before the range")
    void testLedger_OpeningBalance() {
        AccountLedger ledger = generalLedgerService.ledger(bank.getId(), MAY.atDay(5), MAY.atEndOfMonth());

        assertEquals(0, new BigDecimal("5000.00").compareTo(ledger.getOpeningBalance()));
        assertEquals(2, ledger.getEntries().size());
        assertEquals(0, new BigDecimal("6000.00").compareTo(ledger.getClosingBalance()));
    }

    @Test
    @DisplayName("Recompute repairs corrupted running balances and the stored balance")
    void testRecompute_RepairsDrift() {
        jdbcTemplate.update("UPDATE general_ledger SET running_balance = running_balance + 7 WHERE account_id = ?",
            bank.getId());
        jdbcTemplate.update("UPDATE accounts SET current_balance = 1 WHERE id = ?", bank.getId());

        LedgerVerification before = generalLedgerService.verifyAccount(bank.getId());
        assertFalse(before.isConsistent());
        assertEquals(3, before.getMismatchedRows());

        RecomputeResult result = generalLedgerService.recompute(bank.getId());

        assertEquals(3, result.getRowsFolded());
        assertEquals(3, result.getRowsRewritten());
        assertTrue(result.isBalanceChanged());
        assertEquals(0, new BigDecimal("6000.00").compareTo(result.getRecomputedBalance()));
        assertEquals(0, new BigDecimal("6000.00").compareTo(fixtures.balanceOf(bank)));
        assertTrue(generalLedgerService.verifyAccount(bank.getId()).isConsistent());
    }

    @Test
    @DisplayName("Recompute of a consistent account rewrites nothing")
    void testRecompute_Consistent() {
        RecomputeResult result = generalLedgerService.recompute(sales.getId());

        assertEquals(1, result.getRowsFolded());
        assertEquals(0, result.getRowsRewritten());
        assertFalse(result.isBalanceChanged());
    }

    @Test
    @DisplayName("Stored balance always equals the fold of its ledger rows")
    void testFoldMatchesStoredBalance() {
        for (Account account : new Account[] { bank, capital, sales, rent }) {
            LedgerVerification verification = generalLedgerService.verifyAccount(account.getId());
            assertTrue(verification.isConsistent(), "Account " + account.getAccountCode());
            assertEquals(0, verification.getStoredBalance().compareTo(fixtures.balanceOf(account)));
        }
    }

    @Test
    @DisplayName("Ledger range must be ordered")
    void testLedger_InvalidRange() {
        LocalDate end = MAY.atDay(1);
        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> generalLedgerService.ledger(bank.getId(), MAY.atEndOfMonth(), end));
        assertEquals(FailureKind.INVALID_PERIOD_RANGE, e.getKind());
    }
}
