package com.flagship.accounting.voucher;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of {@link Voucher}.
 *
 * Children load lazily; convert with {@link #toDomain()} inside the transaction that loaded the row.
 * {@code version} guards against two approvers acting on the same voucher.
 */
@Entity
@Table(name = "vouchers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VoucherEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "voucher_number", nullable = false, updatable = false, unique = true)
    private String voucherNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "voucher_type", nullable = false, updatable = false)
    private VoucherType voucherType;

    @Column(name = "voucher_date", nullable = false)
    private LocalDate voucherDate;

    @Column(name = "period_id", nullable = false)
    private UUID periodId;

    @Column(name = "party_type")
    private String partyType;

    @Column(name = "party_id")
    private UUID partyId;

    @Column(name = "party_name")
    private String partyName;

    @Column(name = "reference_number")
    private String referenceNumber;

    @Column(name = "reference_date")
    private LocalDate referenceDate;

    @Column
    private String narration;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column
    private String gstin;

    @Column(name = "place_of_supply")
    private String placeOfSupply;

    @Column(name = "is_reverse_charge", nullable = false)
    private boolean reverseCharge;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_mode")
    private PaymentMode paymentMode;

    @Column(name = "bank_account_id")
    private UUID bankAccountId;

    @Column(name = "cheque_number")
    private String chequeNumber;

    @Column(name = "cheque_date")
    private LocalDate chequeDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VoucherStatus status;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "submitted_by")
    private String submittedBy;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_level")
    private ApprovalLevel approvalLevel;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "rejected_by")
    private String rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "posted_by")
    private String postedBy;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "journal_entry_id")
    private UUID journalEntryId;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "is_reversed", nullable = false)
    private boolean reversed;

    @Column(name = "reversal_voucher_id")
    private UUID reversalVoucherId;

    @Column(name = "original_voucher_id", updatable = false)
    private UUID originalVoucherId;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "voucher", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<VoucherLineEntity> lines = new ArrayList<>();

    @OneToMany(mappedBy = "voucher", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<VoucherAllocationEntity> allocations = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static VoucherEntity fromDomain(Voucher voucher) {
        VoucherEntity entity = new VoucherEntity();
        entity.id = voucher.getId();
        entity.voucherNumber = voucher.getVoucherNumber();
        entity.voucherType = voucher.getVoucherType();
        entity.createdBy = voucher.getCreatedBy();
        entity.originalVoucherId = voucher.getOriginalVoucherId();
        entity.updateFromDomain(voucher);
        return entity;
    }

    public Voucher toDomain() {
        return Voucher.builder()
            .id(id)
            .voucherNumber(voucherNumber)
            .voucherType(voucherType)
            .voucherDate(voucherDate)
            .periodId(periodId)
            .partyType(partyType)
            .partyId(partyId)
            .partyName(partyName)
            .referenceNumber(referenceNumber)
            .referenceDate(referenceDate)
            .narration(narration)
            .totalAmount(totalAmount)
            .gstin(gstin)
            .placeOfSupply(placeOfSupply)
            .reverseCharge(reverseCharge)
            .paymentMode(paymentMode)
            .bankAccountId(bankAccountId)
            .chequeNumber(chequeNumber)
            .chequeDate(chequeDate)
            .status(status)
            .createdBy(createdBy)
            .submittedBy(submittedBy)
            .submittedAt(submittedAt)
            .approvalLevel(approvalLevel)
            .approvedBy(approvedBy)
            .approvedAt(approvedAt)
            .rejectedBy(rejectedBy)
            .rejectedAt(rejectedAt)
            .rejectionReason(rejectionReason)
            .postedBy(postedBy)
            .postedAt(postedAt)
            .journalEntryId(journalEntryId)
            .cancelledBy(cancelledBy)
            .cancelledAt(cancelledAt)
            .cancellationReason(cancellationReason)
            .reversed(reversed)
            .reversalVoucherId(reversalVoucherId)
            .originalVoucherId(originalVoucherId)
            .lines(lines.stream().map(VoucherLineEntity::toDomain).toList())
            .allocations(allocations.stream().map(VoucherAllocationEntity::toDomain).toList())
            .build();
    }

    /**
     * Copies header, lifecycle and children. Children are replaced only when their ids changed,
     * which happens on a DRAFT update.
     */
    void updateFromDomain(Voucher voucher) {
        this.voucherDate = voucher.getVoucherDate();
        this.periodId = voucher.getPeriodId();
        this.partyType = voucher.getPartyType();
        this.partyId = voucher.getPartyId();
        this.partyName = voucher.getPartyName();
        this.referenceNumber = voucher.getReferenceNumber();
        this.referenceDate = voucher.getReferenceDate();
        this.narration = voucher.getNarration();
        this.totalAmount = voucher.getTotalAmount();
        this.gstin = voucher.getGstin();
        this.placeOfSupply = voucher.getPlaceOfSupply();
        this.reverseCharge = voucher.isReverseCharge();
        this.paymentMode = voucher.getPaymentMode();
        this.bankAccountId = voucher.getBankAccountId();
        this.chequeNumber = voucher.getChequeNumber();
        this.chequeDate = voucher.getChequeDate();
        this.status = voucher.getStatus();
        this.submittedBy = voucher.getSubmittedBy();
        this.submittedAt = voucher.getSubmittedAt();
        this.approvalLevel = voucher.getApprovalLevel();
        this.approvedBy = voucher.getApprovedBy();
        this.approvedAt = voucher.getApprovedAt();
        this.rejectedBy = voucher.getRejectedBy();
        this.rejectedAt = voucher.getRejectedAt();
        this.rejectionReason = voucher.getRejectionReason();
        this.postedBy = voucher.getPostedBy();
        this.postedAt = voucher.getPostedAt();
        this.journalEntryId = voucher.getJournalEntryId();
        this.cancelledBy = voucher.getCancelledBy();
        this.cancelledAt = voucher.getCancelledAt();
        this.cancellationReason = voucher.getCancellationReason();
        this.reversed = voucher.isReversed();
        this.reversalVoucherId = voucher.getReversalVoucherId();

        List<UUID> currentLineIds = lines.stream().map(VoucherLineEntity::getId).toList();
        List<UUID> newLineIds = voucher.getLines().stream().map(VoucherLine::getId).toList();
        if (!currentLineIds.equals(newLineIds)) {
            lines.clear();
            for (VoucherLine line : voucher.getLines()) {
                lines.add(VoucherLineEntity.fromDomain(line, this));
            }
        }
        List<UUID> currentAllocationIds = allocations.stream().map(VoucherAllocationEntity::getId).toList();
        List<UUID> newAllocationIds = voucher.getAllocations().stream().map(VoucherAllocation::getId).toList();
        if (!currentAllocationIds.equals(newAllocationIds)) {
            allocations.clear();
            for (VoucherAllocation allocation : voucher.getAllocations()) {
                allocations.add(VoucherAllocationEntity.fromDomain(allocation, this));
            }
        }
    }
}
