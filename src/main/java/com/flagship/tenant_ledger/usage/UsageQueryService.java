package com.flagship.tenant_ledger.usage;

import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read contract for billing and plan limits: how much a tenant has posted.
 * Counts are by transaction date, not by posting time.
 */
@Service
@RequiredArgsConstructor
public class UsageQueryService {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public long postingCount(Tenant tenant, YearMonth month) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_vouchers WHERE tenant_id = ? " +
            "AND transaction_date >= ? AND transaction_date <= ?",
            Long.class, tenant.getId(), month.atDay(1), month.atEndOfMonth());
        return count != null ? count : 0L;
    }

    /**
     * Vouchers per origin module in an inclusive date range. Every module is
     * present in the result, with zero when it posted nothing.
     */
    @Transactional(readOnly = true)
    public Map<OriginModule, Long> voucherCounts(Tenant tenant, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Map<OriginModule, Long> counts = new EnumMap<>(OriginModule.class);
        for (OriginModule origin : OriginModule.values()) {
            counts.put(origin, 0L);
        }
        jdbcTemplate.query(
            "SELECT origin, COUNT(*) AS voucher_count FROM journal_vouchers WHERE tenant_id = ? " +
            "AND transaction_date >= ? AND transaction_date <= ? GROUP BY origin",
            rs -> {
                counts.put(OriginModule.valueOf(rs.getString("origin")), rs.getLong("voucher_count"));
            },
            tenant.getId(), from, to);
        return counts;
    }
}
