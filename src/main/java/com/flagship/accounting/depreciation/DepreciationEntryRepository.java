package com.flagship.accounting.depreciation;

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
public interface DepreciationEntryRepository extends JpaRepository<DepreciationEntryEntity, UUID> {

    boolean existsByAssetIdAndPeriodDate(UUID assetId, LocalDate periodDate);

    List<DepreciationEntryEntity> findByAssetIdOrderByPeriodDateAsc(UUID assetId);

    @Query("""
        SELECT e.id FROM DepreciationEntryEntity e
        WHERE e.periodDate = :periodDate AND e.posted = false
        ORDER BY e.referenceNumber
        """)
    List<UUID> findUnpostedIds(@Param("periodDate") LocalDate periodDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM DepreciationEntryEntity e WHERE e.id = :id")
    Optional<DepreciationEntryEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByPostedFalse();
}
