package com.flagship.accounting.costcenter;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CostCenterRepository extends JpaRepository<CostCenterEntity, UUID> {

    boolean existsByCode(String code);

    List<CostCenterEntity> findAllByOrderByCodeAsc();
}
