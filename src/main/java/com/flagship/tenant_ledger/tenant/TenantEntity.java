package com.flagship.tenant_ledger.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the shared tenants table.
 *
 * No setters: the only mutation after onboarding is a status change,
 * done through {@link #changeStatus(TenantStatus)}.
 */
@Entity
@Table(name = "tenants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TenantEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true, length = 63)
    private String identifier;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TenantStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "base_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode baseCurrency;

    @Column(name = "fiscal_year_start_month", nullable = false)
    private int fiscalYearStartMonth;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TenantEntity newTenant(String identifier, String businessName,
                                  CurrencyCode baseCurrency, int fiscalYearStartMonth) {
        return new TenantEntity(
            UUID.randomUUID(),
            identifier,
            businessName,
            TenantStatus.TRIAL,
            baseCurrency,
            fiscalYearStartMonth,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    void changeStatus(TenantStatus newStatus) {
        this.status = newStatus;
    }

    public Tenant toDomain() {
        return new Tenant(id, identifier, businessName, status, baseCurrency, fiscalYearStartMonth, createdAt);
    }
}
