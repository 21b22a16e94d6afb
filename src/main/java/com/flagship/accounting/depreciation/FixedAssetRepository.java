package com.flagship.accounting.depreciation;

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
public interface FixedAssetRepository extends JpaRepository<FixedAssetEntity, UUID> {

    boolean existsByAssetCode(String assetCode);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM FixedAssetEntity a WHERE a.id = :id")
    Optional<FixedAssetEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT a.id FROM FixedAssetEntity a WHERE a.status = :status ORDER BY a.assetCode")
    List<UUID> findIdsByStatus(@Param("status") AssetStatus status);

    @Query("SELECT a.id FROM FixedAssetEntity a WHERE a.status = :status AND a.id IN :ids ORDER BY a.assetCode")
    List<UUID> findIdsByStatusAndIdIn(@Param("status") AssetStatus status, @Param("ids") Collection<UUID> ids);

    @Query("""
        SELECT a FROM FixedAssetEntity a
        WHERE (:status IS NULL OR a.status = :status)
          AND (:categoryId IS NULL OR a.categoryId = :categoryId)
        ORDER BY a.assetCode
        """)
    List<FixedAssetEntity> search(@Param("status") AssetStatus status, @Param("categoryId") UUID categoryId);
}
