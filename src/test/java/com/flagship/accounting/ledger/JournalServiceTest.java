package com.flagship.accounting.ledger;

import com.flagship.accounting.event.JournalEntryPostedEvent;
import com.flagship.accounting.event.JournalEntryReversedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.FinancialPeriodService;
import com.flagship.accounting.support.AbstractIntegrationTest;
import com.flagship.accounting.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JournalServiceTest extends AbstractIntegrationTest {

    private static final YearMonth APRIL = YearMonth.of(2024, 4);
    private static final LocalDate DAY = APRIL.atDay(10);

    @Autowired
    private JournalService journalService;

    @Autowired
    private GeneralLedgerService generalLedgerService;

    @Autowired
    private FinancialPeriodService periodService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerFixtures fixtures;

    private FinancialPeriod april;
    private Account cash;
    private Account sales;

    @BeforeEach
    void setUp() {
        april = fixtures.openMonth(APRIL);
        cash = fixtures.leaf(AccountSubType.CASH, new BigDecimal("1000.00"));
        sales = fixtures.leaf(AccountSubType.SALES_REVENUE);
    }

    @Test
    @DisplayName("Posting moves both balances and writes one ledger row per line")
    void testPost_UpdatesBalancesAndLedger() {
        JournalEntry entry = fixtures.post(DAY, cash, sales, "250.00");

        assertEquals(JournalEntryStatus.POSTED, entry.getStatus());
        assertEquals(april.getId(), entry.getPeriodId());
        assertTrue(entry.getEntryNumber().matches("JV-20240410-\\d{4}"), entry.getEntryNumber());
        assertEquals(0, new BigDecimal("1250.00").compareTo(fixtures.balanceOf(cash)));
        assertEquals(0, new BigDecimal("250.00").compareTo(fixtures.balanceOf(sales)));

        AccountLedger ledger = generalLedgerService.ledger(cash.getId(), APRIL.atDay(1), APRIL.atEndOfMonth());
        assertEquals(1, ledger.getEntries().size());
        assertEquals(0, new BigDecimal("1000.00").compareTo(ledger.getOpeningBalance()));
        assertEquals(0, new BigDecimal("1250.00").compareTo(ledger.getEntries().get(0).getRunningBalance()));
        assertEquals(0, new BigDecimal("1250.00").compareTo(ledger.getClosingBalance()));
    }

    @Test
    @DisplayName("Posting writes a JournalEntryPosted event in the same transaction")
    void testPost_WritesOutboxEvent() {
        JournalEntry entry = fixtures.post(DAY, cash, sales, "10.00");

        var events = outboxService.getEventsForAggregate("JournalEntry", entry.getId());
        assertEquals(1, events.size());
        assertEquals(JournalEntryPostedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains(entry.getEntryNumber()));
    }

    @Test
    @DisplayName("Group accounts reject postings and nothing is written")
    void testPost_GroupAccount() {
        Account group = fixtures.group(AccountSubType.CURRENT_ASSET);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> fixtures.post(DAY, group, sales, "10.00"));

        assertEquals(FailureKind.GROUP_ACCOUNT_POSTING, e.getKind());
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(sales)));
        assertTrue(journalService.listEntries(APRIL.atDay(1), APRIL.atEndOfMonth(), null).isEmpty());
    }

    @Test
    @DisplayName("Inactive accounts reject postings")
    void testPost_InactiveAccount() {
        Account dormant = fixtures.leaf(AccountSubType.BANK);
        accountService.deactivate(dormant.getId());

        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> fixtures.post(DAY, dormant, sales, "5.00"));
        assertEquals(FailureKind.INACTIVE_ACCOUNT, e.getKind());
    }

    @Test
    @DisplayName("Posting outside any period fails with NO_OPEN_PERIOD")
    void testPost_NoPeriod() {
        StateConflictException e = assertThrows(StateConflictException.class,
            () -> fixtures.post(LocalDate.of(2030, 1, 1), cash, sales, "10.00"));

        assertEquals(FailureKind.NO_OPEN_PERIOD, e.getKind());
    }

    @Test
    @DisplayName("Posting into a closed period fails")
    void testPost_ClosedPeriod() {
        periodService.closePeriod(april.getId(), LedgerFixtures.CHECKER);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> fixtures.post(DAY, cash, sales, "10.00"));

        assertEquals(FailureKind.NO_OPEN_PERIOD, e.getKind());
        assertEquals(0, new BigDecimal("1000.00").compareTo(fixtures.balanceOf(cash)));
    }

    @Test
    @DisplayName("Locked period rejects postings")
    void testPost_LockedPeriod() {
        periodService.closePeriod(april.getId(), LedgerFixtures.CHECKER);
        periodService.lockPeriod(april.getId(), LedgerFixtures.CHECKER);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> fixtures.post(DAY, cash, sales, "10.00"));

        assertEquals(FailureKind.NO_OPEN_PERIOD, e.getKind());
        assertEquals(0, new BigDecimal("1000.00").compareTo(fixtures.balanceOf(cash)));
        assertTrue(journalService.listEntries(null, null, null).isEmpty());
    }

    @Test
    @DisplayName("Repeated idempotency key returns the first entry without posting twice")
    void testPost_IdempotencyKey() {
        PostingRequest request = LedgerFixtures.transfer(DAY, cash, sales, "40.00");

        JournalEntry first = journalService.post(request, "key-1");
        JournalEntry second = journalService.post(request, "key-1");

        assertEquals(first.getId(), second.getId());
        assertEquals(0, new BigDecimal("40.00").compareTo(fixtures.balanceOf(sales)));
    }

    @Test
    @DisplayName("Reversal posts the mirror entry and nets the accounts back")
    void testReverse_NetsToZero() {
        JournalEntry original = fixtures.post(DAY, cash, sales, "300.00");

        JournalEntry reversal = journalService.reverse(original.getId(), APRIL.atDay(20), "entered twice", LedgerFixtures.CHECKER);

        assertEquals(JournalEntryType.REVERSAL, reversal.getEntryType());
        assertEquals(original.getId(), reversal.getReversalOfId());
        assertTrue(reversal.getNarration().startsWith("Reversal of " + original.getEntryNumber()));
        assertEquals(0, new BigDecimal("1000.00").compareTo(fixtures.balanceOf(cash)));
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(sales)));

        JournalEntry reloaded = journalService.findById(original.getId());
        assertTrue(reloaded.isReversed());
        assertEquals(JournalEntryStatus.POSTED, reloaded.getStatus());
        assertEquals(reversal.getId(), reloaded.getReversedById());
        assertEquals(1, outboxService.getEventsOfType(JournalEntryReversedEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Second reversal of the same entry fails")
    void testReverse_Twice() {
        JournalEntry original = fixtures.post(DAY, cash, sales, "5.00");
        journalService.reverse(original.getId(), DAY, "first", LedgerFixtures.CHECKER);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> journalService.reverse(original.getId(), DAY, "second", LedgerFixtures.CHECKER));

        assertEquals(FailureKind.ALREADY_REVERSED, e.getKind());
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(sales)));
    }

    @Test
    @DisplayName("Reversal needs an open period on the reversal date")
    void testReverse_NoOpenPeriod() {
        JournalEntry original = fixtures.post(DAY, cash, sales, "60.00");

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> journalService.reverse(original.getId(), APRIL.plusMonths(1).atDay(3), "late", LedgerFixtures.CHECKER));

        assertEquals(FailureKind.NO_OPEN_PERIOD, e.getKind());
        assertFalse(journalService.findById(original.getId()).isReversed());
        assertEquals(0, new BigDecimal("60.00").compareTo(fixtures.balanceOf(sales)));
        assertTrue(outboxService.getEventsOfType(JournalEntryReversedEvent.EVENT_TYPE).isEmpty());
    }

    @Test
    @DisplayName("Reversal carries the original's source document")
    void testReverse_CopiesSource() {
        SourceRef invoice = SourceRef.of("SALES_INVOICE", UUID.randomUUID(), "INV-0042");
        JournalEntry original = journalService.post(LedgerFixtures.transfer(DAY, cash, sales, "80.00")
            .toBuilder().source(invoice).build());

        JournalEntry reversal = journalService.reverse(original.getId(), DAY, "credit note", LedgerFixtures.CHECKER);

        assertEquals("SALES_INVOICE", reversal.getSourceType());
        assertEquals(invoice.getSourceId(), reversal.getSourceId());
        assertEquals("INV-0042", reversal.getSourceNumber());
    }

    @Test
    @DisplayName("Draft entries leave the ledger untouched until posted")
    void testDraft_PostAndCancel() {
        JournalEntry draft = journalService.createDraft(LedgerFixtures.transfer(DAY, cash, sales, "70.00"));
        assertEquals(JournalEntryStatus.DRAFT, draft.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(sales)));

        JournalEntry posted = journalService.postDraft(draft.getId(), LedgerFixtures.CHECKER);
        assertEquals(JournalEntryStatus.POSTED, posted.getStatus());
        assertEquals(draft.getEntryNumber(), posted.getEntryNumber());
        assertEquals(0, new BigDecimal("70.00").compareTo(fixtures.balanceOf(sales)));

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> journalService.cancelDraft(posted.getId(), LedgerFixtures.CHECKER));
        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());

        JournalEntry other = journalService.createDraft(LedgerFixtures.transfer(DAY, cash, sales, "1.00"));
        assertEquals(JournalEntryStatus.CANCELLED, journalService.cancelDraft(other.getId(), LedgerFixtures.MAKER).getStatus());
    }

    @Test
    @DisplayName("Concurrent postings on one account serialize and fold consistently")
    void testPost_Concurrent() throws Exception {
        int threads = 8;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    fixtures.post(DAY, cash, sales, "1.00");
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(0, new BigDecimal("1080.00").compareTo(fixtures.balanceOf(cash)));
        assertEquals(0, new BigDecimal("80.00").compareTo(fixtures.balanceOf(sales)));
        assertTrue(generalLedgerService.verifyAccount(cash.getId()).isConsistent());
        assertTrue(generalLedgerService.verifyAccount(sales.getId()).isConsistent());
        assertEquals(threads * perThread, journalService.listEntries(APRIL.atDay(1), APRIL.atEndOfMonth(), JournalEntryStatus.POSTED).size());
    }
}
