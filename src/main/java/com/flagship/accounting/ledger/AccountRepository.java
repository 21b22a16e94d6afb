package com.flagship.accounting.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByAccountCode(String accountCode);

    boolean existsByAccountCode(String accountCode);

    List<AccountEntity> findAllByOrderByAccountCodeAsc();

    List<AccountEntity> findByAccountTypeOrderByAccountCodeAsc(AccountType accountType);

    long countByParentId(UUID parentId);

    /**
     * Locks account rows in id order. Every writer of {@code current_balance} acquires
     * its locks through this method, so two postings touching the same accounts
     * always lock them in the same order and serialize without deadlocking.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id IN :ids ORDER BY a.id")
    List<AccountEntity> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);
}
