package com.flagship.accounting.voucher;

import com.flagship.accounting.ledger.PostingLine;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A business document that becomes exactly one journal entry once approved and posted.
 *
 * Immutable. Every lifecycle method checks {@link VoucherStatus#canTransitionTo} and
 * returns a new instance.
 */
@Value
@Builder(toBuilder = true)
public class Voucher {
    UUID id;
    String voucherNumber;
    VoucherType voucherType;
    LocalDate voucherDate;
    UUID periodId;
    String partyType;
    UUID partyId;
    String partyName;
    String referenceNumber;
    LocalDate referenceDate;
    String narration;
    BigDecimal totalAmount;
    String gstin;
    String placeOfSupply;
    boolean reverseCharge;
    PaymentMode paymentMode;
    UUID bankAccountId;
    String chequeNumber;
    LocalDate chequeDate;

    VoucherStatus status;
    String createdBy;
    String submittedBy;
    Instant submittedAt;
    ApprovalLevel approvalLevel;
    String approvedBy;
    Instant approvedAt;
    String rejectedBy;
    Instant rejectedAt;
    String rejectionReason;
    String postedBy;
    Instant postedAt;
    UUID journalEntryId;
    String cancelledBy;
    Instant cancelledAt;
    String cancellationReason;

    boolean reversed;
    UUID reversalVoucherId;
    UUID originalVoucherId;

    @Singular
    List<VoucherLine> lines;
    @Singular
    List<VoucherAllocation> allocations;

    static Voucher draft(String voucherNumber, UUID periodId, VoucherCommand command, String user) {
        return withContent(Voucher.builder(), periodId, command)
            .id(UUID.randomUUID())
            .voucherNumber(voucherNumber)
            .status(VoucherStatus.DRAFT)
            .createdBy(user)
            .build();
    }

    /**
     * The mirror of a POSTED voucher: same accounts, debit and credit exchanged.
     * Born APPROVED by the reversing user so it can post immediately.
     */
    static Voucher reversalOf(Voucher original, LocalDate reversalDate, UUID periodId, String reason, String user) {
        List<VoucherLine> swapped = new ArrayList<>();
        for (VoucherLine line : original.lines) {
            swapped.add(new VoucherLine(UUID.randomUUID(), line.getLineNumber(), line.getAccountId(),
                line.getCredit(), line.getDebit(),
                "Reversal: " + (line.getDescription() != null ? line.getDescription() : ""),
                line.getCostCenterId()));
        }
        Instant now = Instant.now();
        return Voucher.builder()
            .id(UUID.randomUUID())
            .voucherNumber("REV-" + original.voucherNumber)
            .voucherType(original.voucherType)
            .voucherDate(reversalDate)
            .periodId(periodId)
            .partyType(original.partyType)
            .partyId(original.partyId)
            .partyName(original.partyName)
            .narration("Reversal of " + original.voucherNumber + ": " + reason)
            .totalAmount(original.totalAmount)
            .paymentMode(original.paymentMode)
            .bankAccountId(original.bankAccountId)
            .status(VoucherStatus.APPROVED)
            .createdBy(user)
            .approvalLevel(original.approvalLevel)
            .approvedBy(user)
            .approvedAt(now)
            .originalVoucherId(original.id)
            .lines(swapped)
            .build();
    }

    Voucher update(UUID newPeriodId, VoucherCommand command) {
        if (status != VoucherStatus.DRAFT) {
            throw new IllegalStateException(
                String.format("Voucher %s is %s, only DRAFT vouchers can be updated", voucherNumber, status));
        }
        // the number prefix was issued for the original type
        return withContent(toBuilder().clearLines().clearAllocations(), newPeriodId, command)
            .voucherType(voucherType)
            .build();
    }

    public Voucher submit(String user, ApprovalLevel level) {
        requireTransition(VoucherStatus.PENDING_APPROVAL);
        return toBuilder()
            .status(VoucherStatus.PENDING_APPROVAL)
            .submittedBy(user)
            .submittedAt(Instant.now())
            .approvalLevel(level)
            .build();
    }

    public Voucher approve(String user) {
        requireTransition(VoucherStatus.APPROVED);
        return toBuilder()
            .status(VoucherStatus.APPROVED)
            .approvedBy(user)
            .approvedAt(Instant.now())
            .build();
    }

    public Voucher reject(String user, String reason) {
        requireTransition(VoucherStatus.REJECTED);
        return toBuilder()
            .status(VoucherStatus.REJECTED)
            .rejectedBy(user)
            .rejectedAt(Instant.now())
            .rejectionReason(reason)
            .build();
    }

    public Voucher post(String user, UUID postedJournalEntryId) {
        requireTransition(VoucherStatus.POSTED);
        return toBuilder()
            .status(VoucherStatus.POSTED)
            .postedBy(user)
            .postedAt(Instant.now())
            .journalEntryId(postedJournalEntryId)
            .build();
    }

    public Voucher cancel(String user, String reason) {
        requireTransition(VoucherStatus.CANCELLED);
        return toBuilder()
            .status(VoucherStatus.CANCELLED)
            .cancelledBy(user)
            .cancelledAt(Instant.now())
            .cancellationReason(reason)
            .build();
    }

    /**
     * Links this POSTED voucher to its reversal. Status stays POSTED.
     */
    public Voucher markReversed(UUID reversalId) {
        if (status != VoucherStatus.POSTED) {
            throw new IllegalStateException("Only POSTED vouchers can be reversed: " + voucherNumber);
        }
        if (reversed) {
            throw new IllegalStateException("Voucher " + voucherNumber + " is already reversed");
        }
        return toBuilder().reversed(true).reversalVoucherId(reversalId).build();
    }

    public List<PostingLine> toPostingLines() {
        return lines.stream().map(VoucherLine::toPostingLine).toList();
    }

    private void requireTransition(VoucherStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move voucher %s from %s to %s", voucherNumber, status, target));
        }
    }

    private static VoucherBuilder withContent(VoucherBuilder builder, UUID periodId, VoucherCommand command) {
        List<VoucherLine> lines = new ArrayList<>();
        int lineNumber = 0;
        for (PostingLine line : command.getLines()) {
            lines.add(VoucherLine.from(++lineNumber, line));
        }
        return builder
            .voucherType(command.getVoucherType())
            .voucherDate(command.getVoucherDate())
            .periodId(periodId)
            .partyType(command.getPartyType())
            .partyId(command.getPartyId())
            .partyName(command.getPartyName())
            .referenceNumber(command.getReferenceNumber())
            .referenceDate(command.getReferenceDate())
            .narration(command.getNarration())
            .totalAmount(command.getDebitTotal())
            .gstin(command.getGstin())
            .placeOfSupply(command.getPlaceOfSupply())
            .reverseCharge(command.isReverseCharge())
            .paymentMode(command.getPaymentMode())
            .bankAccountId(command.getBankAccountId())
            .chequeNumber(command.getChequeNumber())
            .chequeDate(command.getChequeDate())
            .lines(lines)
            .allocations(command.getAllocations().stream().map(VoucherCommand.Allocation::toAllocation).toList());
    }
}
