package com.flagship.accounting.voucher;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VoucherRepository extends JpaRepository<VoucherEntity, UUID> {

    Optional<VoucherEntity> findByVoucherNumber(String voucherNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VoucherEntity v WHERE v.id = :id")
    Optional<VoucherEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT COUNT(v) FROM VoucherEntity v
        WHERE v.voucherDate BETWEEN :startDate AND :endDate AND v.status IN :statuses
        """)
    long countByDateRangeAndStatusIn(@Param("startDate") LocalDate startDate,
                                     @Param("endDate") LocalDate endDate,
                                     @Param("statuses") Collection<VoucherStatus> statuses);

    @Query("""
        SELECT v FROM VoucherEntity v
        WHERE (:status IS NULL OR v.status = :status)
          AND (:type IS NULL OR v.voucherType = :type)
          AND (:fromDate IS NULL OR v.voucherDate >= :fromDate)
          AND (:toDate IS NULL OR v.voucherDate <= :toDate)
        ORDER BY v.voucherDate DESC, v.voucherNumber DESC
        """)
    List<VoucherEntity> search(@Param("status") VoucherStatus status,
                               @Param("type") VoucherType type,
                               @Param("fromDate") LocalDate fromDate,
                               @Param("toDate") LocalDate toDate);

    @Query("""
        SELECT v FROM VoucherEntity v
        WHERE v.status = com.flagship.accounting.voucher.VoucherStatus.PENDING_APPROVAL
          AND (:level IS NULL OR v.approvalLevel = :level)
        ORDER BY v.submittedAt ASC
        """)
    List<VoucherEntity> findPendingApprovals(@Param("level") ApprovalLevel level);

    /**
     * Sum of allocated plus withheld amounts already applied to a source document by
     * vouchers that are not cancelled or rejected, optionally ignoring one voucher.
     */
    @Query("""
        SELECT COALESCE(SUM(a.allocatedAmount + a.tdsAmount), 0)
        FROM VoucherAllocationEntity a JOIN a.voucher v
        WHERE a.sourceType = :sourceType AND a.sourceId = :sourceId
          AND v.status NOT IN (com.flagship.accounting.voucher.VoucherStatus.CANCELLED,
                               com.flagship.accounting.voucher.VoucherStatus.REJECTED)
          AND (:excludeVoucherId IS NULL OR v.id <> :excludeVoucherId)
        """)
    BigDecimal sumConsumedForSource(@Param("sourceType") AllocationSourceType sourceType,
                                    @Param("sourceId") UUID sourceId,
                                    @Param("excludeVoucherId") UUID excludeVoucherId);

    @Query("""
        SELECT v.status, v.voucherType, COUNT(v), COALESCE(SUM(v.totalAmount), 0)
        FROM VoucherEntity v
        WHERE v.voucherDate BETWEEN :fromDate AND :toDate
        GROUP BY v.status, v.voucherType
        """)
    List<Object[]> summarize(@Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);
}
