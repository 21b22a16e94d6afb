package com.flagship.accounting.voucher;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.FinancialPeriodService;
import com.flagship.accounting.sequence.DocumentSequenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Voucher registry: DRAFT authoring and queries. Lifecycle moves live in
 * {@link VoucherWorkflowService}, ledger effects in {@link VoucherPostingService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherService {

    private final VoucherRepository voucherRepository;
    private final VoucherValidator validator;
    private final FinancialPeriodService periodService;
    private final DocumentSequenceService sequenceService;

    @Transactional
    public Voucher create(VoucherCommand command, String user) {
        requireUser(user);
        validator.validate(command, null);
        FinancialPeriod period = periodService.requireOpenPeriod(command.getVoucherDate());

        String number = sequenceService.next(command.getVoucherType().getPrefix(), command.getVoucherDate());
        Voucher voucher = Voucher.draft(number, period.getId(), command, user);
        voucherRepository.save(VoucherEntity.fromDomain(voucher));
        log.info("Created {} voucher {} for {} by {}",
            voucher.getVoucherType(), number, voucher.getTotalAmount(), user);
        return voucher;
    }

    @Transactional
    public Voucher update(UUID voucherId, VoucherCommand command, String user) {
        requireUser(user);
        VoucherEntity entity = loadForUpdate(voucherId);
        Voucher current = entity.toDomain();
        requireDraft(current, "updated");
        if (command.getVoucherType() != null && command.getVoucherType() != current.getVoucherType()) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                "Voucher type cannot change from " + current.getVoucherType());
        }
        VoucherCommand effective = command.getVoucherType() == null
            ? command.toBuilder().voucherType(current.getVoucherType()).build()
            : command;

        validator.validate(effective, voucherId);
        FinancialPeriod period = periodService.requireOpenPeriod(effective.getVoucherDate());

        Voucher updated = current.update(period.getId(), effective);
        entity.updateFromDomain(updated);
        voucherRepository.save(entity);
        log.info("Updated voucher {} by {}", updated.getVoucherNumber(), user);
        return updated;
    }

    @Transactional
    public void delete(UUID voucherId, String user) {
        VoucherEntity entity = loadForUpdate(voucherId);
        Voucher voucher = entity.toDomain();
        requireDraft(voucher, "deleted");
        voucherRepository.delete(entity);
        log.info("Deleted draft voucher {} by {}", voucher.getVoucherNumber(), user);
    }

    @Transactional(readOnly = true)
    public Voucher findById(UUID voucherId) {
        return voucherRepository.findById(voucherId)
            .map(VoucherEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.VOUCHER_NOT_FOUND, "Voucher", voucherId));
    }

    @Transactional(readOnly = true)
    public List<Voucher> list(VoucherStatus status, VoucherType type, LocalDate from, LocalDate to) {
        return voucherRepository.search(status, type, from, to).stream()
            .map(VoucherEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Voucher> pendingApprovals(ApprovalLevel level) {
        return voucherRepository.findPendingApprovals(level).stream()
            .map(VoucherEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public VoucherSummary summary(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Summary requires from and to dates");
        }
        Map<VoucherStatus, VoucherSummary.Bucket> byStatus = new EnumMap<>(VoucherStatus.class);
        Map<VoucherType, VoucherSummary.Bucket> byType = new EnumMap<>(VoucherType.class);
        VoucherSummary.Bucket empty = new VoucherSummary.Bucket(0, BigDecimal.ZERO);
        long total = 0;
        for (Object[] row : voucherRepository.summarize(from, to)) {
            VoucherStatus status = (VoucherStatus) row[0];
            VoucherType type = (VoucherType) row[1];
            long count = ((Number) row[2]).longValue();
            BigDecimal amount = (BigDecimal) row[3];
            byStatus.put(status, byStatus.getOrDefault(status, empty).plus(count, amount));
            byType.put(type, byType.getOrDefault(type, empty).plus(count, amount));
            total += count;
        }
        return new VoucherSummary(from, to, total, byStatus, byType);
    }

    VoucherEntity loadForUpdate(UUID voucherId) {
        return voucherRepository.findByIdForUpdate(voucherId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.VOUCHER_NOT_FOUND, "Voucher", voucherId));
    }

    private static void requireDraft(Voucher voucher, String action) {
        if (voucher.getStatus() != VoucherStatus.DRAFT) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Voucher %s is %s, only DRAFT vouchers can be %s",
                    voucher.getVoucherNumber(), voucher.getStatus(), action));
        }
    }

    static void requireUser(String user) {
        if (user == null || user.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Acting user is required");
        }
    }
}
