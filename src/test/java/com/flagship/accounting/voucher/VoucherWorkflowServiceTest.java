package com.flagship.accounting.voucher;

import com.flagship.accounting.config.AccountingProperties;
import com.flagship.accounting.event.AccountingEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.PostingLine;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Workflow rules checked against mocked persistence; posting itself is covered by the
 * integration tests.
 */
@ExtendWith(MockitoExtension.class)
class VoucherWorkflowServiceTest {

    @Mock
    private VoucherService voucherService;

    @Mock
    private VoucherRepository voucherRepository;

    @Mock
    private VoucherPostingService postingService;

    @Mock
    private OutboxService outboxService;

    private VoucherWorkflowService workflowService;

    @BeforeEach
    void setUp() {
        workflowService = new VoucherWorkflowService(voucherService, voucherRepository, postingService,
            outboxService, new AccountingProperties(), new AccountingMetrics(new SimpleMeterRegistry()));
    }

    private Voucher draft(String amount) {
        VoucherCommand command = VoucherCommand.builder()
            .voucherType(VoucherType.JOURNAL)
            .voucherDate(LocalDate.of(2024, 7, 1))
            .line(PostingLine.debit(UUID.randomUUID(), new BigDecimal(amount), null))
            .line(PostingLine.credit(UUID.randomUUID(), new BigDecimal(amount), null))
            .build();
        return Voucher.draft("JNL-20240701-0001", UUID.randomUUID(), command, "maker");
    }

    private Voucher stub(Voucher voucher) {
        when(voucherService.loadForUpdate(voucher.getId())).thenReturn(VoucherEntity.fromDomain(voucher));
        return voucher;
    }

    @Test
    @DisplayName("Submit fixes the approval level from the total")
    void testSubmit_AssignsLevel() {
        Voucher voucher = stub(draft("75000"));

        Voucher submitted = workflowService.submit(voucher.getId(), "maker");

        assertEquals(VoucherStatus.PENDING_APPROVAL, submitted.getStatus());
        assertEquals(ApprovalLevel.LEVEL_2, submitted.getApprovalLevel());
        verify(voucherRepository).save(any(VoucherEntity.class));
        verify(outboxService).saveEvent(eq("Voucher"), any(AccountingEvent.class));
    }

    @Test
    @DisplayName("Creator cannot approve their own voucher")
    void testApprove_MakerChecker() {
        Voucher voucher = stub(draft("100").submit("maker", ApprovalLevel.LEVEL_1));

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> workflowService.approve(voucher.getId(), "maker", false));

        assertEquals(FailureKind.MAKER_CHECKER_VIOLATION, e.getKind());
        verify(voucherRepository, never()).save(any());
        verify(outboxService, never()).saveEvent(any(), any(AccountingEvent.class));
    }

    @Test
    @DisplayName("Creator cannot reject their own voucher")
    void testReject_MakerChecker() {
        Voucher voucher = stub(draft("100").submit("maker", ApprovalLevel.LEVEL_1));

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> workflowService.reject(voucher.getId(), "maker", "wrong account"));

        assertEquals(FailureKind.MAKER_CHECKER_VIOLATION, e.getKind());
    }

    @Test
    @DisplayName("Approve without auto-post leaves the voucher APPROVED")
    void testApprove_NoAutoPost() {
        Voucher voucher = stub(draft("100").submit("maker", ApprovalLevel.LEVEL_1));

        Voucher approved = workflowService.approve(voucher.getId(), "checker", false);

        assertEquals(VoucherStatus.APPROVED, approved.getStatus());
        assertEquals("checker", approved.getApprovedBy());
        verify(postingService, never()).post(any(VoucherEntity.class), any(), any());
    }

    @Test
    @DisplayName("Approve with auto-post hands the approved voucher to posting")
    void testApprove_AutoPost() {
        Voucher voucher = stub(draft("100").submit("maker", ApprovalLevel.LEVEL_1));
        when(postingService.post(any(VoucherEntity.class), any(Voucher.class), eq("checker")))
            .thenAnswer(inv -> inv.getArgument(1, Voucher.class).post("checker", UUID.randomUUID()));

        Voucher posted = workflowService.approve(voucher.getId(), "checker", true);

        assertEquals(VoucherStatus.POSTED, posted.getStatus());
    }

    @Test
    @DisplayName("Retuned limits do not block vouchers already waiting for approval")
    void testApprove_AfterLimitsRetuned() {
        AccountingProperties properties = new AccountingProperties();
        workflowService = new VoucherWorkflowService(voucherService, voucherRepository, postingService,
            outboxService, properties, new AccountingMetrics(new SimpleMeterRegistry()));
        Voucher voucher = stub(draft("60000"));
        Voucher submitted = workflowService.submit(voucher.getId(), "maker");
        assertEquals(ApprovalLevel.LEVEL_2, submitted.getApprovalLevel());

        properties.getApproval().setLevel1Limit(new BigDecimal("100000"));
        stub(submitted);
        Voucher approved = workflowService.approve(voucher.getId(), "checker", false);

        assertEquals(VoucherStatus.APPROVED, approved.getStatus());
        assertEquals(ApprovalLevel.LEVEL_2, approved.getApprovalLevel());
    }

    @Test
    @DisplayName("Approving a DRAFT is an invalid transition")
    void testApprove_FromDraft() {
        Voucher voucher = stub(draft("100"));

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> workflowService.approve(voucher.getId(), "checker", false));

        assertEquals(FailureKind.INVALID_TRANSITION, e.getKind());
    }

    @Test
    @DisplayName("Reject and cancel require a reason")
    void testReasonRequired() {
        UUID id = UUID.randomUUID();

        assertEquals(FailureKind.MISSING_FIELD, assertThrows(ValidationFailureException.class,
            () -> workflowService.reject(id, "checker", " ")).getKind());
        assertEquals(FailureKind.MISSING_FIELD, assertThrows(ValidationFailureException.class,
            () -> workflowService.cancel(id, "maker", null)).getKind());
    }

    @Test
    @DisplayName("A rejected voucher can be cancelled but not approved")
    void testRejectedThenCancelled() {
        Voucher rejected = stub(draft("100").submit("maker", ApprovalLevel.LEVEL_1).reject("checker", "typo"));

        assertThrows(StateConflictException.class, () -> workflowService.approve(rejected.getId(), "checker", false));
        Voucher cancelled = workflowService.cancel(rejected.getId(), "maker", "abandoned");

        assertEquals(VoucherStatus.CANCELLED, cancelled.getStatus());
        assertEquals("abandoned", cancelled.getCancellationReason());
    }
}
