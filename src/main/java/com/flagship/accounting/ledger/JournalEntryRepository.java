package com.flagship.accounting.ledger;

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
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    Optional<JournalEntryEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<JournalEntryEntity> findByEntryNumber(String entryNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JournalEntryEntity j WHERE j.id = :id")
    Optional<JournalEntryEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT COUNT(j) FROM JournalEntryEntity j
        WHERE j.entryDate BETWEEN :startDate AND :endDate
          AND j.status = com.flagship.accounting.ledger.JournalEntryStatus.DRAFT
        """)
    long countDraftsBetween(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    @Query("""
        SELECT j FROM JournalEntryEntity j
        WHERE j.entryDate BETWEEN :from AND :to
          AND (:status IS NULL OR j.status = :status)
        ORDER BY j.entryDate ASC, j.entryNumber ASC
        """)
    List<JournalEntryEntity> findEntries(@Param("from") LocalDate from,
                                         @Param("to") LocalDate to,
                                         @Param("status") JournalEntryStatus status);
}
