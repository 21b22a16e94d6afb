package com.flagship.accounting.period;

import com.flagship.accounting.event.PeriodClosedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.Account;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.ledger.PostingLine;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.support.AbstractIntegrationTest;
import com.flagship.accounting.support.LedgerFixtures;
import com.flagship.accounting.voucher.Voucher;
import com.flagship.accounting.voucher.VoucherCommand;
import com.flagship.accounting.voucher.VoucherService;
import com.flagship.accounting.voucher.VoucherType;
import com.flagship.accounting.voucher.VoucherWorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.YearMonth;

import static com.flagship.accounting.support.LedgerFixtures.CHECKER;
import static com.flagship.accounting.support.LedgerFixtures.MAKER;
import static org.junit.jupiter.api.Assertions.*;

class FinancialPeriodServiceTest extends AbstractIntegrationTest {

    private static final YearMonth JULY = YearMonth.of(2024, 7);

    @Autowired
    private FinancialPeriodService periodService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private VoucherService voucherService;

    @Autowired
    private VoucherWorkflowService workflowService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerFixtures fixtures;

    private FinancialPeriod july;
    private Account cash;
    private Account income;

    @BeforeEach
    void setUp() {
        july = fixtures.openMonth(JULY);
        cash = fixtures.leaf(AccountSubType.CASH);
        income = fixtures.leaf(AccountSubType.OTHER_INCOME);
    }

    @Test
    @DisplayName("Overlapping periods are refused")
    void testCreate_Overlap() {
        StateConflictException e = assertThrows(StateConflictException.class,
            () -> periodService.createPeriod("Mid July", PeriodType.MONTHLY, JULY.atDay(15), JULY.plusMonths(1).atDay(14), false));

        assertEquals(FailureKind.PERIOD_OVERLAP, e.getKind());
    }

    @Test
    @DisplayName("Start after end is refused")
    void testCreate_InvalidRange() {
        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> periodService.createPeriod("Backwards", PeriodType.MONTHLY, JULY.plusMonths(2).atEndOfMonth(),
                JULY.plusMonths(2).atDay(1), false));

        assertEquals(FailureKind.INVALID_PERIOD_RANGE, e.getKind());
    }

    @Test
    @DisplayName("Closing with a draft entry reports the count and leaves the period OPEN")
    void testClose_DraftBlocks() {
        JournalEntry draft = journalService.createDraft(LedgerFixtures.transfer(JULY.atDay(3), cash, income, "10.00"));

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> periodService.closePeriod(july.getId(), CHECKER));

        assertEquals(FailureKind.UNPOSTED_ENTRIES_IN_PERIOD, e.getKind());
        assertTrue(e.getMessage().contains("1 unposted"), e.getMessage());
        assertEquals(PeriodStatus.OPEN, periodService.findById(july.getId()).getStatus());

        journalService.postDraft(draft.getId(), CHECKER);
        assertEquals(PeriodStatus.CLOSED, periodService.closePeriod(july.getId(), CHECKER).getStatus());
    }

    @Test
    @DisplayName("Unfinished vouchers block closing too")
    void testClose_VoucherBlocks() {
        VoucherCommand command = VoucherCommand.builder()
            .voucherType(VoucherType.JOURNAL)
            .voucherDate(JULY.atDay(9))
            .line(PostingLine.debit(cash.getId(), new BigDecimal("5"), null))
            .line(PostingLine.credit(income.getId(), new BigDecimal("5"), null))
            .build();
        Voucher first = voucherService.create(command, MAKER);
        Voucher second = voucherService.create(command, MAKER);
        workflowService.submit(second.getId(), MAKER);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> periodService.closePeriod(july.getId(), CHECKER));
        assertTrue(e.getMessage().contains("2 unposted"), e.getMessage());

        workflowService.cancel(first.getId(), MAKER, "not needed");
        workflowService.approve(second.getId(), CHECKER, true);
        assertEquals(PeriodStatus.CLOSED, periodService.closePeriod(july.getId(), CHECKER).getStatus());
    }

    @Test
    @DisplayName("Close, reopen and lock follow the status graph")
    void testLifecycle() {
        FinancialPeriod closed = periodService.closePeriod(july.getId(), CHECKER);
        assertEquals(CHECKER, closed.getClosedBy());
        assertNotNull(closed.getClosedAt());
        assertEquals(1, outboxService.getEventsOfType(PeriodClosedEvent.EVENT_TYPE).size());

        assertEquals(FailureKind.PERIOD_NOT_OPEN, assertThrows(StateConflictException.class,
            () -> periodService.closePeriod(july.getId(), CHECKER)).getKind());

        assertEquals(PeriodStatus.OPEN, periodService.reopenPeriod(july.getId(), CHECKER).getStatus());
        fixtures.post(JULY.atDay(4), cash, income, "1.00");

        periodService.closePeriod(july.getId(), CHECKER);
        assertEquals(PeriodStatus.LOCKED, periodService.lockPeriod(july.getId(), CHECKER).getStatus());
        assertEquals(FailureKind.INVALID_TRANSITION, assertThrows(StateConflictException.class,
            () -> periodService.reopenPeriod(july.getId(), CHECKER)).getKind());
    }

    @Test
    @DisplayName("Open period lookup resolves the containing period")
    void testRequireOpenPeriod() {
        assertEquals(july.getId(), periodService.requireOpenPeriod(JULY.atDay(31)).getId());
        assertTrue(periodService.hasOpenPeriod(JULY.atDay(1)));
        assertFalse(periodService.hasOpenPeriod(JULY.plusMonths(1).atDay(1)));
    }
}
