package com.flagship.tenant_ledger.depreciation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FixedAssetRepository extends JpaRepository<FixedAssetEntity, UUID> {

    Optional<FixedAssetEntity> findByTenantIdAndId(UUID tenantId, UUID id);

    List<FixedAssetEntity> findByTenantIdAndStatusOrderByAcquisitionDateAsc(UUID tenantId, AssetStatus status);

    boolean existsByTenantIdAndAssetNumber(UUID tenantId, String assetNumber);
}
