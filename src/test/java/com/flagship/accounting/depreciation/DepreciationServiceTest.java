package com.flagship.accounting.depreciation;

import com.flagship.accounting.event.DepreciationRecordedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.ledger.Account;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalEntryType;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.support.AbstractIntegrationTest;
import com.flagship.accounting.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static com.flagship.accounting.support.LedgerFixtures.CHECKER;
import static org.junit.jupiter.api.Assertions.*;

class DepreciationServiceTest extends AbstractIntegrationTest {

    private static final YearMonth AUGUST = YearMonth.of(2024, 8);
    private static final BigDecimal TWENTY = new BigDecimal("20");

    @Autowired
    private DepreciationService depreciationService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerFixtures fixtures;

    private Account accumulated;
    private Account expense;
    private AssetCategory machinery;

    @BeforeEach
    void setUp() {
        Account machineryAccount = fixtures.leaf(AccountSubType.FIXED_ASSET);
        accumulated = fixtures.leaf(AccountSubType.ACCUMULATED_DEPRECIATION);
        expense = fixtures.leaf(AccountSubType.DEPRECIATION_EXPENSE);
        machinery = assetService.createCategory("MACH", "Machinery", DepreciationMethod.SLM, TWENTY, 5,
            machineryAccount.getId(), accumulated.getId(), expense.getId());
    }

    private FixedAsset lathe(AssetCategory category, LocalDate acquired) {
        return assetService.registerAsset("FA-LATHE", "Lathe", category.getId(), acquired,
            new BigDecimal("120000"), null, null, BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Run posts Dr expense / Cr accumulated depreciation and lowers book value")
    void testRun_PostsJournalEntry() {
        fixtures.openMonth(AUGUST);
        FixedAsset asset = lathe(machinery, AUGUST.atDay(1));

        DepreciationRunResult result = depreciationService.run(AUGUST.atDay(15), null, CHECKER);

        assertEquals(AUGUST.atEndOfMonth(), result.getPeriodDate());
        assertEquals(1, result.getEntries().size());
        assertEquals(1, result.getPostedCount());
        DepreciationEntry entry = result.getEntries().get(0);
        assertEquals(0, new BigDecimal("2000.00").compareTo(entry.getAmount()));
        assertEquals("2024-25", entry.getFinancialYear());
        assertTrue(entry.getReferenceNumber().startsWith("DEP-20240831-"), entry.getReferenceNumber());

        JournalEntry journalEntry = journalService.findById(entry.getJournalEntryId());
        assertEquals(JournalEntryType.DEPRECIATION, journalEntry.getEntryType());
        assertEquals("Depreciation for Lathe - August 2024", journalEntry.getNarration());
        assertEquals(0, new BigDecimal("2000.00").compareTo(fixtures.balanceOf(expense)));
        assertEquals(0, new BigDecimal("-2000.00").compareTo(fixtures.balanceOf(accumulated)));

        FixedAsset after = assetService.findById(asset.getId());
        assertEquals(0, new BigDecimal("118000.00").compareTo(after.getCurrentBookValue()));
        assertEquals(AUGUST.atEndOfMonth(), after.getLastDepreciationDate());
        assertEquals(1, outboxService.getEventsOfType(DepreciationRecordedEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Depreciation journal entries cannot be reversed directly")
    void testDirectReversalRefused() {
        fixtures.openMonth(AUGUST);
        FixedAsset asset = lathe(machinery, AUGUST.atDay(1));
        DepreciationEntry entry = depreciationService.run(AUGUST.atDay(31), null, CHECKER).getEntries().get(0);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> journalService.reverse(entry.getJournalEntryId(), AUGUST.atDay(31), "undo", CHECKER));

        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());
        assertFalse(journalService.findById(entry.getJournalEntryId()).isReversed());
        assertEquals(0, new BigDecimal("2000.00").compareTo(fixtures.balanceOf(expense)));
        assertEquals(0, new BigDecimal("118000.00").compareTo(assetService.findById(asset.getId()).getCurrentBookValue()));
    }

    @Test
    @DisplayName("Running the same month twice yields one entry")
    void testRun_SameMonthTwice() {
        fixtures.openMonth(AUGUST);
        FixedAsset asset = lathe(machinery, AUGUST.atDay(1));

        depreciationService.run(AUGUST.atDay(31), null, CHECKER);
        DepreciationRunResult again = depreciationService.run(AUGUST.atDay(2), null, CHECKER);

        assertTrue(again.getEntries().isEmpty());
        assertTrue(again.getSkipped().get(asset.getId()).startsWith("already depreciated"));
        assertEquals(1, assetService.schedule(asset.getId()).size());
        assertEquals(0, new BigDecimal("2000.00").compareTo(fixtures.balanceOf(expense)));
    }

    @Test
    @DisplayName("SLM asset reaches zero after 60 runs and the 61st produces nothing")
    void testRun_SixtyMonthsToZero() {
        AssetCategory unmapped = assetService.createCategory("TOOLS", "Tools", DepreciationMethod.SLM, TWENTY, 5,
            null, null, null);
        FixedAsset asset = lathe(unmapped, LocalDate.of(2024, 1, 1));

        YearMonth month = YearMonth.of(2024, 1);
        for (int i = 0; i < 60; i++) {
            DepreciationRunResult result = depreciationService.run(month.atDay(1), List.of(asset.getId()), CHECKER);
            assertEquals(1, result.getEntries().size(), "Month " + month);
            assertEquals(0, result.getPostedCount(), "Unmapped category records without posting");
            month = month.plusMonths(1);
        }

        FixedAsset depreciated = assetService.findById(asset.getId());
        assertEquals(0, depreciated.getCurrentBookValue().signum());
        assertEquals(0, new BigDecimal("120000").compareTo(depreciated.getAccumulatedDepreciation()));

        DepreciationRunResult last = depreciationService.run(month.atDay(1), List.of(asset.getId()), CHECKER);
        assertTrue(last.getEntries().isEmpty());
        assertEquals("fully depreciated", last.getSkipped().get(asset.getId()));
        assertEquals(60, assetService.schedule(asset.getId()).size());
    }

    @Test
    @DisplayName("Entries computed without an open period post once the period exists")
    void testPostPending() {
        FixedAsset asset = lathe(machinery, AUGUST.atDay(1));

        DepreciationRunResult computed = depreciationService.run(AUGUST.atDay(31), null, CHECKER);
        assertEquals(1, computed.getEntries().size());
        assertFalse(computed.getEntries().get(0).isPosted());
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(expense)));

        fixtures.openMonth(AUGUST);
        DepreciationRunResult posted = depreciationService.postPending(AUGUST.atDay(1), CHECKER);

        assertEquals(1, posted.getPostedCount());
        assertEquals(0, new BigDecimal("2000.00").compareTo(fixtures.balanceOf(expense)));
        assertTrue(assetService.schedule(asset.getId()).get(0).isPosted());
        assertTrue(depreciationService.postPending(AUGUST.atDay(1), CHECKER).getEntries().isEmpty());
    }

    @Test
    @DisplayName("Inactive and later-acquired assets are skipped")
    void testRun_Skips() {
        fixtures.openMonth(AUGUST);
        FixedAsset repairing = lathe(machinery, AUGUST.atDay(1));
        assetService.changeStatus(repairing.getId(), AssetStatus.UNDER_MAINTENANCE);
        FixedAsset future = assetService.registerAsset("FA-FUTURE", "Press", machinery.getId(),
            AUGUST.plusMonths(1).atDay(1), new BigDecimal("6000"), DepreciationMethod.WDV, new BigDecimal("12"), null);

        DepreciationRunResult result = depreciationService.run(AUGUST.atDay(31),
            List.of(repairing.getId(), future.getId()), CHECKER);

        assertTrue(result.getEntries().isEmpty());
        assertEquals("not found or not ACTIVE", result.getSkipped().get(repairing.getId()));
        assertTrue(result.getSkipped().get(future.getId()).startsWith("acquired after"));
        assertTrue(result.getFailed().isEmpty());
    }

    @Test
    @DisplayName("Final asset states cannot be left")
    void testChangeStatus_Final() {
        FixedAsset asset = lathe(machinery, AUGUST.atDay(1));
        assetService.changeStatus(asset.getId(), AssetStatus.DISPOSED);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> assetService.changeStatus(asset.getId(), AssetStatus.ACTIVE));

        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());
    }
}
