package com.flagship.accounting.costcenter;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.Account;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.ledger.PostingLine;
import com.flagship.accounting.ledger.PostingRequest;
import com.flagship.accounting.support.AbstractIntegrationTest;
import com.flagship.accounting.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

import static com.flagship.accounting.support.LedgerFixtures.MAKER;
import static org.junit.jupiter.api.Assertions.*;

class CostCenterServiceTest extends AbstractIntegrationTest {

    private static final YearMonth JANUARY = YearMonth.of(2024, 1);

    @Autowired
    private CostCenterService costCenterService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private LedgerFixtures fixtures;

    private CostCenter marketing;

    @BeforeEach
    void setUp() {
        marketing = costCenterService.create("CC-MKT", "Marketing", null, CostCenterType.DEPARTMENT,
            new BigDecimal("10000"));
    }

    @Test
    @DisplayName("Utilization sums tagged expense lines inside the range")
    void testBudgetUtilization() {
        fixtures.openMonth(JANUARY);
        Account bank = fixtures.leaf(AccountSubType.BANK, new BigDecimal("5000.00"));
        Account ads = fixtures.leaf(AccountSubType.OPERATING_EXPENSE);
        journalService.post(PostingRequest.builder()
            .entryDate(JANUARY.atDay(10))
            .narration("Ad campaign")
            .line(PostingLine.of(ads.getId(), new BigDecimal("2500.00"), null, "Search ads", marketing.getId()))
            .line(PostingLine.credit(bank.getId(), new BigDecimal("2500.00"), null))
            .createdBy(MAKER)
            .build());
        fixtures.post(JANUARY.atDay(11), ads, bank, "100.00");

        BudgetUtilization utilization = costCenterService.budgetUtilization(marketing.getId(),
            JANUARY.atDay(1), JANUARY.atEndOfMonth());

        assertEquals(0, new BigDecimal("2500.00").compareTo(utilization.getSpend()));
        assertEquals(0, new BigDecimal("7500.00").compareTo(utilization.getRemaining()));
        assertEquals(0, new BigDecimal("25.00").compareTo(utilization.getUtilizationPercent()));
    }

    @Test
    @DisplayName("Without a budget only spend is reported")
    void testBudgetUtilization_NoBudget() {
        CostCenter branch = costCenterService.create("CC-BR1", "Pune branch", marketing.getId(),
            CostCenterType.BRANCH, null);

        BudgetUtilization utilization = costCenterService.budgetUtilization(branch.getId(),
            JANUARY.atDay(1), JANUARY.atEndOfMonth());

        assertEquals(0, utilization.getSpend().signum());
        assertNull(utilization.getRemaining());
        assertNull(utilization.getUtilizationPercent());
    }

    @Test
    @DisplayName("Inactive cost centers cannot be referenced")
    void testRequireActive() {
        costCenterService.deactivate(marketing.getId());

        ReferenceNotFoundException e = assertThrows(ReferenceNotFoundException.class,
            () -> costCenterService.requireActive(List.of(marketing.getId())));

        assertEquals(FailureKind.COST_CENTER_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("Codes are unique and budgets non-negative")
    void testCreate_Validation() {
        assertEquals(FailureKind.DUPLICATE_CODE, assertThrows(ValidationFailureException.class,
            () -> costCenterService.create("CC-MKT", "Again", null, CostCenterType.DEPARTMENT, null)).getKind());
        assertEquals(FailureKind.INVALID_LINE, assertThrows(ValidationFailureException.class,
            () -> costCenterService.create("CC-NEG", "Negative", null, CostCenterType.PROJECT,
                new BigDecimal("-1"))).getKind());
    }
}
