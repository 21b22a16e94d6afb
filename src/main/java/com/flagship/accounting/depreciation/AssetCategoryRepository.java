package com.flagship.accounting.depreciation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssetCategoryRepository extends JpaRepository<AssetCategoryEntity, UUID> {

    boolean existsByCode(String code);

    List<AssetCategoryEntity> findAllByOrderByCodeAsc();
}
