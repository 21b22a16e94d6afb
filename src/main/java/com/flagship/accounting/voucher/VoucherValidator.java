package com.flagship.accounting.voucher;

import com.flagship.accounting.costcenter.CostCenterService;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.AccountService;
import com.flagship.accounting.ledger.PostingLine;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Checks voucher content before it is stored. Runs for create and for every DRAFT update.
 */
@Component
@RequiredArgsConstructor
class VoucherValidator {

    private final AccountService accountService;
    private final CostCenterService costCenterService;
    private final VoucherRepository voucherRepository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Must run inside the caller's transaction: allocation sources are locked until it ends.
     *
     * @param voucherId the voucher being updated, whose own allocations do not count against outstanding; null on create
     */
    void validate(VoucherCommand command, UUID voucherId) {
        if (command.getVoucherType() == null || command.getVoucherDate() == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Voucher type and date are required");
        }
        if (command.getLines().isEmpty()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Voucher requires at least one line");
        }
        BigDecimal debit = command.getDebitTotal();
        BigDecimal credit = command.getCreditTotal();
        if (debit.compareTo(credit) != 0) {
            throw new ValidationFailureException(FailureKind.INVALID_BALANCE,
                String.format("Voucher must balance: debits=%s, credits=%s", debit, credit));
        }
        if (debit.signum() <= 0) {
            throw new ValidationFailureException(FailureKind.ZERO_AMOUNT, "Voucher total must be greater than zero");
        }

        VoucherType type = command.getVoucherType();
        if (type.requiresParty() && command.getPartyId() == null
            && (command.getPartyName() == null || command.getPartyName().isBlank())) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, type + " voucher requires a party");
        }
        if (type.requiresBank() && command.getBankAccountId() == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, type + " voucher requires a bank account");
        }

        Set<UUID> accountIds = new LinkedHashSet<>();
        Set<UUID> costCenterIds = new LinkedHashSet<>();
        for (PostingLine line : command.getLines()) {
            accountIds.add(line.getAccountId());
            if (line.getCostCenterId() != null) {
                costCenterIds.add(line.getCostCenterId());
            }
        }
        if (command.getBankAccountId() != null) {
            accountIds.add(command.getBankAccountId());
        }
        accountService.requirePostable(accountIds);
        costCenterService.requireActive(costCenterIds);

        validateAllocations(command, debit, voucherId);
    }

    private void validateAllocations(VoucherCommand command, BigDecimal voucherTotal, UUID voucherId) {
        if (command.getAllocations().isEmpty()) {
            return;
        }
        if (!command.getVoucherType().supportsAllocation()) {
            throw new ValidationFailureException(FailureKind.INVALID_ALLOCATION,
                command.getVoucherType() + " vouchers do not take allocations");
        }

        lockSources(command);

        BigDecimal totalAllocated = BigDecimal.ZERO;
        Map<String, BigDecimal> consumedInThisVoucher = new HashMap<>();
        for (VoucherCommand.Allocation allocation : command.getAllocations()) {
            if (allocation.getSourceType() == null || allocation.getSourceId() == null
                || allocation.getDocumentAmount() == null || allocation.getAllocatedAmount() == null) {
                throw new ValidationFailureException(FailureKind.MISSING_FIELD,
                    "Allocation requires source type, source id, document amount and allocated amount");
            }
            BigDecimal tds = allocation.getTdsAmount() != null ? allocation.getTdsAmount() : BigDecimal.ZERO;
            if (allocation.getAllocatedAmount().signum() <= 0 || tds.signum() < 0
                || allocation.getDocumentAmount().signum() <= 0) {
                throw new ValidationFailureException(FailureKind.INVALID_ALLOCATION,
                    "Allocation amounts must be positive for source " + allocation.getSourceId());
            }

            String sourceKey = allocation.getSourceType() + ":" + allocation.getSourceId();
            BigDecimal consumed = allocation.getAllocatedAmount().add(tds);
            BigDecimal alreadyInVoucher = consumedInThisVoucher.getOrDefault(sourceKey, BigDecimal.ZERO);
            BigDecimal consumedElsewhere = voucherRepository.sumConsumedForSource(
                allocation.getSourceType(), allocation.getSourceId(), voucherId);
            BigDecimal outstanding = allocation.getDocumentAmount()
                .subtract(consumedElsewhere)
                .subtract(alreadyInVoucher);
            if (consumed.compareTo(outstanding) > 0) {
                throw new ValidationFailureException(FailureKind.INVALID_ALLOCATION,
                    String.format("Allocation of %s exceeds outstanding %s on %s %s",
                        consumed, outstanding, allocation.getSourceType(),
                        allocation.getSourceNumber() != null ? allocation.getSourceNumber() : allocation.getSourceId()));
            }
            consumedInThisVoucher.put(sourceKey, alreadyInVoucher.add(consumed));
            totalAllocated = totalAllocated.add(allocation.getAllocatedAmount());
        }
        if (totalAllocated.compareTo(voucherTotal) > 0) {
            throw new ValidationFailureException(FailureKind.INVALID_ALLOCATION,
                String.format("Allocated total %s exceeds voucher total %s", totalAllocated, voucherTotal));
        }
    }

    /**
     * Serializes allocation against the same source document. Locks are taken in key order
     * and released when the transaction ends.
     */
    private void lockSources(VoucherCommand command) {
        SortedSet<String> keys = new TreeSet<>();
        for (VoucherCommand.Allocation allocation : command.getAllocations()) {
            if (allocation.getSourceType() != null && allocation.getSourceId() != null) {
                keys.add(allocation.getSourceType() + ":" + allocation.getSourceId());
            }
        }
        for (String key : keys) {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))", rs -> { }, key);
        }
    }
}
