package com.flagship.tenant_ledger.depreciation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for the fixed_assets table.
 *
 * Everything except the status and the disposal details is fixed at registration.
 */
@Entity
@Table(name = "fixed_assets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FixedAssetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "asset_number", updatable = false, length = 50)
    private String assetNumber;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(name = "acquisition_date", nullable = false, updatable = false)
    private LocalDate acquisitionDate;

    @Column(nullable = false, updatable = false)
    private long cost;

    @Column(name = "salvage_value", nullable = false, updatable = false)
    private long salvageValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method", nullable = false, updatable = false, length = 30)
    private DepreciationMethod method;

    @Column(name = "useful_life_months", nullable = false, updatable = false)
    private int usefulLifeMonths;

    @Column(name = "declining_rate_bps", nullable = false, updatable = false)
    private int decliningRateBps;

    @Column(name = "expense_account_id", nullable = false, updatable = false)
    private UUID expenseAccountId;

    @Column(name = "accumulated_account_id", nullable = false, updatable = false)
    private UUID accumulatedAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AssetStatus status;

    @Column(name = "disposal_date")
    private LocalDate disposalDate;

    @Column(name = "disposal_proceeds")
    private Long disposalProceeds;

    @Column(name = "disposal_voucher_id")
    private UUID disposalVoucherId;

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

    static FixedAssetEntity fromDomain(FixedAsset asset) {
        FixedAssetEntity entity = new FixedAssetEntity();
        entity.id = asset.getId();
        entity.tenantId = asset.getTenantId();
        entity.assetNumber = asset.getAssetNumber();
        entity.name = asset.getName();
        entity.acquisitionDate = asset.getAcquisitionDate();
        entity.cost = asset.getCost();
        entity.salvageValue = asset.getSalvageValue();
        entity.method = asset.getMethod();
        entity.usefulLifeMonths = asset.getUsefulLifeMonths();
        entity.decliningRateBps = asset.getDecliningRateBps();
        entity.expenseAccountId = asset.getExpenseAccountId();
        entity.accumulatedAccountId = asset.getAccumulatedAccountId();
        entity.status = asset.getStatus();
        return entity;
    }

    public FixedAsset toDomain() {
        return FixedAsset.builder()
            .id(id)
            .tenantId(tenantId)
            .assetNumber(assetNumber)
            .name(name)
            .acquisitionDate(acquisitionDate)
            .cost(cost)
            .salvageValue(salvageValue)
            .method(method)
            .usefulLifeMonths(usefulLifeMonths)
            .decliningRateBps(decliningRateBps)
            .expenseAccountId(expenseAccountId)
            .accumulatedAccountId(accumulatedAccountId)
            .status(status)
            .disposalDate(disposalDate)
            .disposalProceeds(disposalProceeds)
            .build();
    }

    void markFullyDepreciated() {
        this.status = AssetStatus.FULLY_DEPRECIATED;
    }

    void markDisposed(LocalDate date, long proceeds, UUID voucherId) {
        this.status = AssetStatus.DISPOSED;
        this.disposalDate = date;
        this.disposalProceeds = proceeds;
        this.disposalVoucherId = voucherId;
    }
}
