package com.flagship.tenant_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Hands out voucher sequence numbers from the persisted per-tenant counter.
 *
 * The counter is advanced and committed in its own transaction before the
 * voucher is written. A number is therefore never handed out twice, even if
 * the posting that asked for it later fails or the process restarts. Failed
 * postings leave gaps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VoucherNumberAllocator {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long next(UUID tenantId) {
        Long allocated = jdbcTemplate.queryForObject(
            "INSERT INTO voucher_sequences (tenant_id, next_value) VALUES (?, 2) " +
            "ON CONFLICT (tenant_id) DO UPDATE SET next_value = voucher_sequences.next_value + 1 " +
            "RETURNING next_value - 1",
            Long.class, tenantId);
        if (allocated == null) {
            throw new IllegalStateException("Voucher sequence allocation returned nothing for tenant " + tenantId);
        }
        log.debug("Allocated voucher sequence {} for tenant {}", allocated, tenantId);
        return allocated;
    }
}
