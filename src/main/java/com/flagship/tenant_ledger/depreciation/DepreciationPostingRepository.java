package com.flagship.tenant_ledger.depreciation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One row per (tenant, asset, period). The primary key makes a second
 * posting for the same period impossible.
 */
@Repository
@RequiredArgsConstructor
public class DepreciationPostingRepository {

    private final JdbcTemplate jdbcTemplate;

    public void insert(UUID tenantId, UUID assetId, YearMonth period, long amount, UUID voucherId) {
        jdbcTemplate.update(
            "INSERT INTO depreciation_postings (tenant_id, asset_id, period, amount, voucher_id) " +
            "VALUES (?, ?, ?, ?, ?)",
            tenantId, assetId, period.toString(), amount, voucherId);
    }

    public boolean exists(UUID tenantId, UUID assetId, YearMonth period) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM depreciation_postings " +
            "WHERE tenant_id = ? AND asset_id = ? AND period = ?)",
            Boolean.class, tenantId, assetId, period.toString());
        return Boolean.TRUE.equals(exists);
    }

    public long accumulated(UUID tenantId, UUID assetId) {
        Long total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM depreciation_postings WHERE tenant_id = ? AND asset_id = ?",
            Long.class, tenantId, assetId);
        return total != null ? total : 0L;
    }

    public Optional<YearMonth> lastPeriod(UUID tenantId, UUID assetId) {
        List<String> periods = jdbcTemplate.queryForList(
            "SELECT MAX(period) FROM depreciation_postings WHERE tenant_id = ? AND asset_id = ?",
            String.class, tenantId, assetId);
        return periods.stream()
            .filter(period -> period != null)
            .findFirst()
            .map(YearMonth::parse);
    }
}
