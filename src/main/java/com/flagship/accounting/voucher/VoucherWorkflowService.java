package com.flagship.accounting.voucher;

import com.flagship.accounting.config.AccountingProperties;
import com.flagship.accounting.event.VoucherStatusChangedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.observability.CorrelationContext;
import com.flagship.accounting.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Maker-checker workflow for vouchers.
 *
 * Each move locks the voucher row, checks the status table and writes a
 * VoucherStatusChanged event. Whoever created a voucher can neither approve nor reject it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherWorkflowService {

    private static final String AGGREGATE_TYPE = "Voucher";

    private final VoucherService voucherService;
    private final VoucherRepository voucherRepository;
    private final VoucherPostingService postingService;
    private final OutboxService outboxService;
    private final AccountingProperties properties;
    private final AccountingMetrics metrics;

    /**
     * DRAFT -> PENDING_APPROVAL. The approval level is fixed here from the voucher total.
     */
    @Transactional
    public Voucher submit(UUID voucherId, String user) {
        VoucherService.requireUser(user);
        return withVoucher(voucherId, "submit", (entity, voucher) -> {
            requireTransition(voucher, VoucherStatus.PENDING_APPROVAL, "submitted");
            Voucher submitted = voucher.submit(user, approvalLevelFor(voucher.getTotalAmount()));
            return save(entity, voucher, submitted, user, null);
        });
    }

    /**
     * PENDING_APPROVAL -> APPROVED, and on to POSTED when {@code autoPost} is set.
     * With auto-post, a posting failure rolls the approval back as well.
     */
    @Transactional
    public Voucher approve(UUID voucherId, String approver, boolean autoPost) {
        VoucherService.requireUser(approver);
        return withVoucher(voucherId, "approve", (entity, voucher) -> {
            requireTransition(voucher, VoucherStatus.APPROVED, "approved");
            requireChecker(voucher, approver, "approve");
            ApprovalLevel required = approvalLevelFor(voucher.getTotalAmount());
            if (voucher.getApprovalLevel() != required) {
                log.warn("Voucher {} was routed at {} but current limits give {} for total {}",
                    voucher.getVoucherNumber(), voucher.getApprovalLevel(), required, voucher.getTotalAmount());
            }
            Voucher approved = save(entity, voucher, voucher.approve(approver), approver, null);
            return autoPost ? postingService.post(entity, approved, approver) : approved;
        });
    }

    @Transactional
    public Voucher reject(UUID voucherId, String user, String reason) {
        VoucherService.requireUser(user);
        requireReason(reason, "Rejection");
        return withVoucher(voucherId, "reject", (entity, voucher) -> {
            requireTransition(voucher, VoucherStatus.REJECTED, "rejected");
            requireChecker(voucher, user, "reject");
            return save(entity, voucher, voucher.reject(user, reason), user, reason);
        });
    }

    /**
     * DRAFT or REJECTED -> CANCELLED.
     */
    @Transactional
    public Voucher cancel(UUID voucherId, String user, String reason) {
        VoucherService.requireUser(user);
        requireReason(reason, "Cancellation");
        return withVoucher(voucherId, "cancel", (entity, voucher) -> {
            requireTransition(voucher, VoucherStatus.CANCELLED, "cancelled");
            return save(entity, voucher, voucher.cancel(user, reason), user, reason);
        });
    }

    ApprovalLevel approvalLevelFor(BigDecimal amount) {
        return ApprovalLevel.forAmount(amount,
            properties.getApproval().getLevel1Limit(),
            properties.getApproval().getLevel2Limit());
    }

    private Voucher withVoucher(UUID voucherId, String transition, Transition action) {
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
        try {
            VoucherEntity entity = voucherService.loadForUpdate(voucherId);
            Voucher result = action.apply(entity, entity.toDomain());
            metrics.recordVoucherTransition(transition, "success");
            return result;
        } catch (RuntimeException e) {
            metrics.recordVoucherTransition(transition, "rejected");
            log.warn("Voucher {} failed for {}: {}", transition, voucherId, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    private Voucher save(VoucherEntity entity, Voucher before, Voucher after, String actor, String reason) {
        entity.updateFromDomain(after);
        voucherRepository.save(entity);
        outboxService.saveEvent(AGGREGATE_TYPE, VoucherStatusChangedEvent.of(before, after, actor, reason));
        log.info("Voucher {} moved {} -> {} by {}",
            after.getVoucherNumber(), before.getStatus(), after.getStatus(), actor);
        return after;
    }

    private static void requireTransition(Voucher voucher, VoucherStatus target, String action) {
        if (!voucher.getStatus().canTransitionTo(target)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Voucher %s is %s and cannot be %s",
                    voucher.getVoucherNumber(), voucher.getStatus(), action));
        }
    }

    private static void requireChecker(Voucher voucher, String user, String action) {
        if (user.equals(voucher.getCreatedBy())) {
            throw new StateConflictException(FailureKind.MAKER_CHECKER_VIOLATION,
                String.format("User %s created voucher %s and cannot %s it",
                    user, voucher.getVoucherNumber(), action));
        }
    }

    private static void requireReason(String reason, String what) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, what + " reason is required");
        }
    }

    @FunctionalInterface
    private interface Transition {
        Voucher apply(VoucherEntity entity, Voucher voucher);
    }
}
