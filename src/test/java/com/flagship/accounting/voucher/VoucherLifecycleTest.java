package com.flagship.accounting.voucher;

import com.flagship.accounting.event.VoucherPostedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.Account;
import com.flagship.accounting.ledger.AccountService;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalEntryType;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.ledger.PostingLine;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flagship.accounting.support.LedgerFixtures.CHECKER;
import static com.flagship.accounting.support.LedgerFixtures.MAKER;
import static org.junit.jupiter.api.Assertions.*;

class VoucherLifecycleTest extends AbstractIntegrationTest {

    private static final YearMonth JUNE = YearMonth.of(2024, 6);
    private static final LocalDate DAY = JUNE.atDay(12);

    @Autowired
    private VoucherService voucherService;

    @Autowired
    private VoucherWorkflowService workflowService;

    @Autowired
    private VoucherPostingService postingService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerFixtures fixtures;

    private Account bank;
    private Account rent;

    @BeforeEach
    void setUp() {
        fixtures.openMonth(JUNE);
        bank = fixtures.leaf(AccountSubType.BANK, new BigDecimal("50000.00"));
        rent = fixtures.leaf(AccountSubType.OPERATING_EXPENSE);
    }

    private VoucherCommand payment(String amount) {
        return VoucherCommand.builder()
            .voucherType(VoucherType.PAYMENT)
            .voucherDate(DAY)
            .partyName("Landlord Pvt Ltd")
            .paymentMode(PaymentMode.NEFT)
            .bankAccountId(bank.getId())
            .line(PostingLine.debit(rent.getId(), new BigDecimal(amount), "June rent"))
            .line(PostingLine.credit(bank.getId(), new BigDecimal(amount), "NEFT"))
            .build();
    }

    private Voucher submitted(String amount) {
        Voucher draft = voucherService.create(payment(amount), MAKER);
        return workflowService.submit(draft.getId(), MAKER);
    }

    @Test
    @DisplayName("Payment voucher goes DRAFT -> POSTED and moves the bank balance")
    void testPayment_SubmitApproveAutoPost() {
        Voucher draft = voucherService.create(payment("10000"), MAKER);
        assertEquals(VoucherStatus.DRAFT, draft.getStatus());
        assertTrue(draft.getVoucherNumber().startsWith("PAY-20240612-"), draft.getVoucherNumber());

        Voucher pending = workflowService.submit(draft.getId(), MAKER);
        assertEquals(ApprovalLevel.LEVEL_1, pending.getApprovalLevel());

        Voucher posted = workflowService.approve(draft.getId(), CHECKER, true);

        assertEquals(VoucherStatus.POSTED, posted.getStatus());
        assertNotNull(posted.getJournalEntryId());
        JournalEntry entry = journalService.findById(posted.getJournalEntryId());
        assertEquals(JournalEntryType.VOUCHER, entry.getEntryType());
        assertEquals("JV-" + posted.getVoucherNumber(), entry.getEntryNumber());
        assertEquals(0, new BigDecimal("10000").compareTo(entry.getTotalDebit()));
        assertEquals(posted.getId(), entry.getSourceId());
        assertEquals(0, new BigDecimal("40000.00").compareTo(fixtures.balanceOf(bank)));
        assertEquals(0, new BigDecimal("10000.00").compareTo(fixtures.balanceOf(rent)));
        assertEquals(1, outboxService.getEventsOfType(VoucherPostedEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Maker cannot approve their own voucher")
    void testApprove_MakerChecker() {
        Voucher pending = submitted("10000");

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> workflowService.approve(pending.getId(), MAKER, true));

        assertEquals(FailureKind.MAKER_CHECKER_VIOLATION, e.getKind());
        assertEquals(VoucherStatus.PENDING_APPROVAL, voucherService.findById(pending.getId()).getStatus());
        assertEquals(0, new BigDecimal("50000.00").compareTo(fixtures.balanceOf(bank)));
    }

    @Test
    @DisplayName("Totals above the first limit need a higher approval level")
    void testSubmit_ApprovalLevels() {
        fixtures.post(DAY, bank, fixtures.leaf(AccountSubType.SHARE_CAPITAL), "1000000.00");

        assertEquals(ApprovalLevel.LEVEL_2, submitted("50000.01").getApprovalLevel());
        assertEquals(ApprovalLevel.LEVEL_3, submitted("500000.01").getApprovalLevel());
        assertEquals(2, voucherService.pendingApprovals(null).size());
        assertEquals(1, voucherService.pendingApprovals(ApprovalLevel.LEVEL_3).size());
    }

    @Test
    @DisplayName("Failed posting leaves the voucher APPROVED and the ledger untouched")
    void testPost_FailureKeepsApproved() {
        Voucher pending = submitted("500");
        workflowService.approve(pending.getId(), CHECKER, false);
        accountService.deactivate(rent.getId());

        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> postingService.post(pending.getId(), CHECKER));

        assertEquals(FailureKind.INACTIVE_ACCOUNT, e.getKind());
        Voucher reloaded = voucherService.findById(pending.getId());
        assertEquals(VoucherStatus.APPROVED, reloaded.getStatus());
        assertNull(reloaded.getJournalEntryId());
        assertEquals(0, new BigDecimal("50000.00").compareTo(fixtures.balanceOf(bank)));

        accountService.activate(rent.getId());
        assertEquals(VoucherStatus.POSTED, postingService.post(pending.getId(), CHECKER).getStatus());
    }

    @Test
    @DisplayName("Auto-post failure rolls the approval back too")
    void testApprove_AutoPostFailureRollsBack() {
        Voucher pending = submitted("500");
        accountService.deactivate(rent.getId());

        assertThrows(ValidationFailureException.class, () -> workflowService.approve(pending.getId(), CHECKER, true));

        assertEquals(VoucherStatus.PENDING_APPROVAL, voucherService.findById(pending.getId()).getStatus());
    }

    @Test
    @DisplayName("Reversing a posted voucher posts a mirror voucher and restores balances")
    void testReverse() {
        Voucher pending = submitted("2500");
        Voucher posted = workflowService.approve(pending.getId(), CHECKER, true);

        Voucher reversal = postingService.reverse(posted.getId(), JUNE.atDay(20), "paid twice", CHECKER);

        assertEquals("REV-" + posted.getVoucherNumber(), reversal.getVoucherNumber());
        assertEquals(VoucherStatus.POSTED, reversal.getStatus());
        assertEquals(posted.getId(), reversal.getOriginalVoucherId());
        assertEquals(0, new BigDecimal("50000.00").compareTo(fixtures.balanceOf(bank)));
        assertEquals(0, BigDecimal.ZERO.compareTo(fixtures.balanceOf(rent)));

        Voucher original = voucherService.findById(posted.getId());
        assertTrue(original.isReversed());
        assertEquals(VoucherStatus.POSTED, original.getStatus());
        assertEquals(reversal.getId(), original.getReversalVoucherId());
        assertTrue(journalService.findById(posted.getJournalEntryId()).isReversed());

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> postingService.reverse(posted.getId(), JUNE.atDay(21), "again", CHECKER));
        assertEquals(FailureKind.ALREADY_REVERSED, e.getKind());
    }

    @Test
    @DisplayName("A voucher's journal entry is reversed only through the voucher")
    void testReverse_JournalEntryOwnedByVoucher() {
        Voucher posted = workflowService.approve(submitted("800").getId(), CHECKER, true);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> journalService.reverse(posted.getJournalEntryId(), DAY, "direct", CHECKER));

        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());
        assertTrue(e.getMessage().contains(posted.getVoucherNumber()), e.getMessage());
        assertFalse(journalService.findById(posted.getJournalEntryId()).isReversed());

        Voucher reversal = postingService.reverse(posted.getId(), DAY, "duplicate payment", CHECKER);
        assertEquals(VoucherStatus.POSTED, reversal.getStatus());
        assertTrue(voucherService.findById(posted.getId()).isReversed());
        assertEquals(0, new BigDecimal("50000.00").compareTo(fixtures.balanceOf(bank)));
    }

    @Test
    @DisplayName("Voucher reversal needs an open period on the reversal date")
    void testReverse_NoOpenPeriod() {
        Voucher posted = workflowService.approve(submitted("300").getId(), CHECKER, true);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> postingService.reverse(posted.getId(), JUNE.plusMonths(1).atDay(2), "late", CHECKER));

        assertEquals(FailureKind.NO_OPEN_PERIOD, e.getKind());
        Voucher reloaded = voucherService.findById(posted.getId());
        assertFalse(reloaded.isReversed());
        assertNull(reloaded.getReversalVoucherId());
        assertFalse(journalService.findById(posted.getJournalEntryId()).isReversed());
        assertEquals(0, new BigDecimal("49700.00").compareTo(fixtures.balanceOf(bank)));
    }

    @Test
    @DisplayName("Only POSTED vouchers can be reversed")
    void testReverse_NotPosted() {
        Voucher pending = submitted("100");

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> postingService.reverse(pending.getId(), DAY, "nope", CHECKER));

        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());
    }

    @Test
    @DisplayName("Payment voucher without a bank account is rejected")
    void testCreate_MissingBank() {
        VoucherCommand command = payment("100").toBuilder().bankAccountId(null).build();

        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> voucherService.create(command, MAKER));

        assertEquals(FailureKind.MISSING_FIELD, e.getKind());
    }

    @Test
    @DisplayName("Allocations cannot consume more than a document's outstanding amount")
    void testAllocation_Overconsumed() {
        UUID invoiceId = UUID.randomUUID();
        VoucherCommand first = payment("600").toBuilder()
            .allocation(new VoucherCommand.Allocation(AllocationSourceType.VENDOR_INVOICE, invoiceId, "INV-7",
                new BigDecimal("1000"), new BigDecimal("600"), BigDecimal.ZERO))
            .build();
        voucherService.create(first, MAKER);

        VoucherCommand second = payment("500").toBuilder()
            .allocation(new VoucherCommand.Allocation(AllocationSourceType.VENDOR_INVOICE, invoiceId, "INV-7",
                new BigDecimal("1000"), new BigDecimal("450"), new BigDecimal("50")))
            .build();

        ValidationFailureException e = assertThrows(ValidationFailureException.class,
            () -> voucherService.create(second, MAKER));
        assertEquals(FailureKind.INVALID_ALLOCATION, e.getKind());

        VoucherCommand fits = payment("400").toBuilder()
            .allocation(new VoucherCommand.Allocation(AllocationSourceType.VENDOR_INVOICE, invoiceId, "INV-7",
                new BigDecimal("1000"), new BigDecimal("360"), new BigDecimal("40")))
            .build();
        assertEquals(1, voucherService.create(fits, MAKER).getAllocations().size());
    }

    @Test
    @DisplayName("Concurrent vouchers cannot together over-allocate one invoice")
    void testAllocation_ConcurrentCreates() throws Exception {
        UUID invoiceId = UUID.randomUUID();
        VoucherCommand command = payment("600").toBuilder()
            .allocation(new VoucherCommand.Allocation(AllocationSourceType.VENDOR_INVOICE, invoiceId, "INV-9",
                new BigDecimal("1000"), new BigDecimal("600"), BigDecimal.ZERO))
            .build();
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Voucher>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                return voucherService.create(command, MAKER);
            }));
        }
        start.countDown();

        int created = 0;
        int refused = 0;
        for (Future<Voucher> future : futures) {
            try {
                future.get(60, TimeUnit.SECONDS);
                created++;
            } catch (ExecutionException e) {
                ValidationFailureException failure = assertInstanceOf(ValidationFailureException.class, e.getCause());
                assertEquals(FailureKind.INVALID_ALLOCATION, failure.getKind());
                refused++;
            }
        }
        executor.shutdown();

        assertEquals(1, created);
        assertEquals(threads - 1, refused);
    }

    @Test
    @DisplayName("Drafts can be edited and deleted; submitted vouchers cannot")
    void testUpdateAndDelete() {
        Voucher draft = voucherService.create(payment("100"), MAKER);

        Voucher updated = voucherService.update(draft.getId(), payment("150"), MAKER);
        assertEquals(0, new BigDecimal("150").compareTo(updated.getTotalAmount()));
        assertEquals(draft.getVoucherNumber(), updated.getVoucherNumber());

        workflowService.submit(draft.getId(), MAKER);
        assertThrows(StateConflictException.class, () -> voucherService.update(draft.getId(), payment("200"), MAKER));
        assertThrows(StateConflictException.class, () -> voucherService.delete(draft.getId(), MAKER));

        Voucher other = voucherService.create(payment("10"), MAKER);
        voucherService.delete(other.getId(), MAKER);
        assertTrue(voucherService.list(null, null, null, null).stream().noneMatch(v -> v.getId().equals(other.getId())));
    }
}
