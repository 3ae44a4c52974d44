package com.flagship.tenant_ledger.tenant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantRepository extends JpaRepository<TenantEntity, UUID> {

    Optional<TenantEntity> findByIdentifier(String identifier);

    boolean existsByIdentifier(String identifier);

    List<TenantEntity> findByStatusNot(TenantStatus status);
}
