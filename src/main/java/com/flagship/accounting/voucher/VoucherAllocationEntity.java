package com.flagship.accounting.voucher;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "voucher_allocations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VoucherAllocationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "voucher_id", nullable = false, updatable = false)
    private VoucherEntity voucher;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false)
    private AllocationSourceType sourceType;

    @Column(name = "source_id", nullable = false, updatable = false)
    private UUID sourceId;

    @Column(name = "source_number", updatable = false)
    private String sourceNumber;

    @Column(name = "document_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal documentAmount;

    @Column(name = "allocated_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal allocatedAmount;

    @Column(name = "tds_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal tdsAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static VoucherAllocationEntity fromDomain(VoucherAllocation allocation, VoucherEntity voucher) {
        VoucherAllocationEntity entity = new VoucherAllocationEntity();
        entity.id = allocation.getId();
        entity.voucher = voucher;
        entity.sourceType = allocation.getSourceType();
        entity.sourceId = allocation.getSourceId();
        entity.sourceNumber = allocation.getSourceNumber();
        entity.documentAmount = allocation.getDocumentAmount();
        entity.allocatedAmount = allocation.getAllocatedAmount();
        entity.tdsAmount = allocation.getTdsAmount();
        return entity;
    }

    VoucherAllocation toDomain() {
        return new VoucherAllocation(id, sourceType, sourceId, sourceNumber,
            documentAmount, allocatedAmount, tdsAmount);
    }
}
