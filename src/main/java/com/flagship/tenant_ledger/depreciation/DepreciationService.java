package com.flagship.tenant_ledger.depreciation;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.ledger.TenantLock;
import com.flagship.tenant_ledger.ledger.exception.AssetNotFoundException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers fixed assets, posts their monthly depreciation and takes them off
 * the books on disposal.
 *
 * Each (asset, period) produces at most one voucher:
 * Dr Depreciation Expense, Cr Accumulated Depreciation, dated the last day of
 * the period and tagged with the asset as source document. Running the same
 * period twice is a no-op. The whole run for one period holds the tenant's
 * ledger lock, so the duplicate check and the posting cannot interleave with
 * another run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepreciationService {

    private final FixedAssetRepository assetRepository;
    private final DepreciationPostingRepository postingRepository;
    private final ChartOfAccountsService chartOfAccounts;
    private final LedgerService ledgerService;
    private final TenantLock tenantLock;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public FixedAsset registerAsset(Tenant tenant, AssetRegistration registration) {
        if (registration.getCost() <= 0) {
            throw new IllegalArgumentException("Asset cost must be positive");
        }
        if (registration.getSalvageValue() < 0 || registration.getSalvageValue() > registration.getCost()) {
            throw new IllegalArgumentException("Salvage value must be between 0 and cost");
        }
        if (registration.getUsefulLifeMonths() <= 0) {
            throw new IllegalArgumentException("Useful life must be at least one month");
        }
        if (registration.getMethod() == DepreciationMethod.DECLINING_BALANCE
                && (registration.getDecliningRateBps() <= 0 || registration.getDecliningRateBps() > 10_000)) {
            throw new IllegalArgumentException("Declining rate must be between 1 and 10000 basis points");
        }
        if (registration.getAssetNumber() != null
                && assetRepository.existsByTenantIdAndAssetNumber(tenant.getId(), registration.getAssetNumber())) {
            throw new IllegalArgumentException("Asset number already registered: " + registration.getAssetNumber());
        }

        Account expense = resolveAccount(tenant, registration.getExpenseAccountId(), SystemAccount.DEPRECIATION_EXPENSE);
        Account accumulated = resolveAccount(tenant, registration.getAccumulatedAccountId(),
            SystemAccount.ACCUMULATED_DEPRECIATION);

        FixedAsset asset = FixedAsset.builder()
            .id(UUID.randomUUID())
            .tenantId(tenant.getId())
            .assetNumber(registration.getAssetNumber())
            .name(registration.getName())
            .acquisitionDate(registration.getAcquisitionDate())
            .cost(registration.getCost())
            .salvageValue(registration.getSalvageValue())
            .method(registration.getMethod())
            .usefulLifeMonths(registration.getUsefulLifeMonths())
            .decliningRateBps(registration.getMethod() == DepreciationMethod.DECLINING_BALANCE
                ? registration.getDecliningRateBps() : 0)
            .expenseAccountId(expense.getId())
            .accumulatedAccountId(accumulated.getId())
            .status(registration.getCost() == registration.getSalvageValue()
                ? AssetStatus.FULLY_DEPRECIATED : AssetStatus.ACTIVE)
            .build();
        FixedAsset saved = assetRepository.save(FixedAssetEntity.fromDomain(asset)).toDomain();
        log.info("Registered fixed asset {} ({}) for tenant {}: cost={}, method={}, life={} months",
            saved.getName(), saved.getId(), tenant.getIdentifier(), saved.getCost(),
            saved.getMethod(), saved.getUsefulLifeMonths());
        return saved;
    }

    @Transactional(readOnly = true)
    public FixedAsset findAsset(Tenant tenant, UUID assetId) {
        return assetRepository.findByTenantIdAndId(tenant.getId(), assetId)
            .map(FixedAssetEntity::toDomain)
            .orElseThrow(() -> new AssetNotFoundException(assetId));
    }

    @Transactional(readOnly = true)
    public List<FixedAsset> findActiveAssets(Tenant tenant) {
        return assetRepository.findByTenantIdAndStatusOrderByAcquisitionDateAsc(tenant.getId(), AssetStatus.ACTIVE)
            .stream()
            .map(FixedAssetEntity::toDomain)
            .toList();
    }

    /**
     * The first period not yet posted for the asset.
     */
    @Transactional(readOnly = true)
    public YearMonth nextPeriod(Tenant tenant, FixedAsset asset) {
        return postingRepository.lastPeriod(tenant.getId(), asset.getId())
            .map(period -> period.plusMonths(1))
            .orElse(asset.getFirstPeriod());
    }

    /**
     * Posts the depreciation of one asset for one period.
     *
     * @return the voucher, or empty when the period was already posted or
     *         nothing is due (inactive asset, period before acquisition, fully depreciated)
     */
    @Transactional
    public Optional<JournalVoucher> runDepreciation(Tenant tenant, UUID assetId, YearMonth period) {
        tenantLock.acquire(tenant.getId());

        FixedAssetEntity entity = assetRepository.findByTenantIdAndId(tenant.getId(), assetId)
            .orElseThrow(() -> new AssetNotFoundException(assetId));
        FixedAsset asset = entity.toDomain();
        if (asset.getStatus() != AssetStatus.ACTIVE) {
            log.debug("Skipping depreciation of {} asset {}", asset.getStatus(), assetId);
            return Optional.empty();
        }
        if (postingRepository.exists(tenant.getId(), assetId, period)) {
            log.debug("Depreciation of asset {} for {} already posted", assetId, period);
            return Optional.empty();
        }

        long accumulated = postingRepository.accumulated(tenant.getId(), assetId);
        long charge = DepreciationCalculator.chargeFor(asset, period, accumulated);
        if (charge <= 0) {
            if (DepreciationCalculator.isFullyDepreciated(asset, accumulated)) {
                entity.markFullyDepreciated();
                assetRepository.save(entity);
            }
            return Optional.empty();
        }

        PostingRequest request = PostingRequest.builder()
            .origin(OriginModule.DEPRECIATION)
            .transactionDate(period.atEndOfMonth())
            .note("Depreciation " + period + ": " + asset.getName())
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.FIXED_ASSET, assetId.toString()))
            .idempotencyKey("depreciation:" + assetId + ":" + period)
            .line(PostingLine.debit(asset.getExpenseAccountId(), charge, "Depreciation expense"))
            .line(PostingLine.credit(asset.getAccumulatedAccountId(), charge, "Accumulated depreciation"))
            .build();
        JournalVoucher voucher = ledgerService.commit(tenant, request);
        postingRepository.insert(tenant.getId(), assetId, period, charge, voucher.getId());

        if (DepreciationCalculator.isFullyDepreciated(asset, accumulated + charge)) {
            entity.markFullyDepreciated();
            assetRepository.save(entity);
            log.info("Asset {} is fully depreciated", assetId);
        }
        ledgerMetrics.recordDepreciationPosted(asset.getMethod().name());
        log.info("Posted depreciation of {} for asset {} period {} as {}",
            charge, assetId, period, voucher.getVoucherNumber());
        return Optional.of(voucher);
    }

    /**
     * Disposes of an asset for the given proceeds. The voucher removes the
     * asset at cost and its accumulated depreciation, books the proceeds and
     * recognises the difference from book value:
     * Dr Accumulated Depreciation, Dr proceeds account, Cr Fixed Assets,
     * then Cr Other Income for a gain or Dr Loss on Asset Disposal for a loss.
     *
     * Book value is taken from the depreciation posted so far; periods not yet
     * run are not charged. Depreciation stops once the asset is disposed.
     *
     * @param proceedsAccountId account receiving the proceeds, Bank when null
     */
    @Transactional
    public AssetDisposal disposeAsset(Tenant tenant, UUID assetId, LocalDate disposalDate,
                                      long proceeds, UUID proceedsAccountId) {
        if (proceeds < 0) {
            throw new IllegalArgumentException("Disposal proceeds must not be negative");
        }
        tenantLock.acquire(tenant.getId());

        FixedAssetEntity entity = assetRepository.findByTenantIdAndId(tenant.getId(), assetId)
            .orElseThrow(() -> new AssetNotFoundException(assetId));
        FixedAsset asset = entity.toDomain();
        if (asset.getStatus() == AssetStatus.DISPOSED) {
            throw new IllegalArgumentException("Asset already disposed: " + assetId);
        }
        if (disposalDate.isBefore(asset.getAcquisitionDate())) {
            throw new IllegalArgumentException("Disposal date precedes acquisition of asset " + assetId);
        }

        long accumulated = postingRepository.accumulated(tenant.getId(), assetId);
        long bookValue = asset.getCost() - accumulated;
        long gain = proceeds - bookValue;
        String label = "Disposal of " + asset.getName();

        PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
            .origin(OriginModule.DEPRECIATION)
            .transactionDate(disposalDate)
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.FIXED_ASSET, assetId.toString()))
            .idempotencyKey("disposal:" + assetId);
        if (accumulated > 0) {
            request.line(PostingLine.debit(asset.getAccumulatedAccountId(), accumulated, "Accumulated depreciation written back"));
        }
        if (proceeds > 0) {
            UUID receiving = resolveAccount(tenant, proceedsAccountId, SystemAccount.BANK).getId();
            request.line(PostingLine.debit(receiving, proceeds, "Disposal proceeds"));
        }
        request.line(PostingLine.credit(chartOfAccounts.requireSystemAccount(tenant, SystemAccount.FIXED_ASSETS).getId(),
            asset.getCost(), "Asset removed at cost"));
        if (gain > 0) {
            request.line(PostingLine.credit(chartOfAccounts.requireSystemAccount(tenant, SystemAccount.OTHER_INCOME).getId(),
                gain, "Gain on disposal"));
        } else if (gain < 0) {
            request.line(PostingLine.debit(chartOfAccounts.requireSystemAccount(tenant, SystemAccount.LOSS_ON_DISPOSAL).getId(),
                -gain, "Loss on disposal"));
        }
        JournalVoucher voucher = ledgerService.commit(tenant, request.build());

        entity.markDisposed(disposalDate, proceeds, voucher.getId());
        FixedAsset disposed = assetRepository.save(entity).toDomain();
        log.info("Disposed asset {} for tenant {}: bookValue={}, proceeds={}, gain={}, voucher={}",
            assetId, tenant.getIdentifier(), bookValue, proceeds, gain, voucher.getVoucherNumber());
        return new AssetDisposal(disposed, voucher, bookValue, proceeds, gain);
    }

    private Account resolveAccount(Tenant tenant, UUID accountId, SystemAccount fallback) {
        if (accountId == null) {
            return chartOfAccounts.requireSystemAccount(tenant, fallback);
        }
        Account account = chartOfAccounts.requireAccount(tenant, accountId);
        if (!account.isActive()) {
            throw new UnknownAccountException(accountId);
        }
        return account;
    }
}
