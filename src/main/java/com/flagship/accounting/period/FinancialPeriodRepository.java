package com.flagship.accounting.period;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FinancialPeriodRepository extends JpaRepository<FinancialPeriodEntity, UUID> {

    @Query("""
        SELECT COUNT(p) FROM FinancialPeriodEntity p
        WHERE p.startDate <= :endDate AND p.endDate >= :startDate
        """)
    long countOverlapping(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    /**
     * Finds the OPEN period containing the date and takes a shared lock on it,
     * so the period cannot be closed until the posting transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("""
        SELECT p FROM FinancialPeriodEntity p
        WHERE p.status = com.flagship.accounting.period.PeriodStatus.OPEN
          AND p.startDate <= :date AND p.endDate >= :date
        """)
    List<FinancialPeriodEntity> findOpenContainingForShare(@Param("date") LocalDate date);

    @Query("""
        SELECT COUNT(p) > 0 FROM FinancialPeriodEntity p
        WHERE p.status = com.flagship.accounting.period.PeriodStatus.OPEN
          AND p.startDate <= :date AND p.endDate >= :date
        """)
    boolean existsOpenContaining(@Param("date") LocalDate date);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM FinancialPeriodEntity p WHERE p.id = :id")
    Optional<FinancialPeriodEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByPeriodName(String periodName);

    List<FinancialPeriodEntity> findAllByOrderByStartDateAsc();
}
