package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.account.AccountRepository;
import com.flagship.tenant_ledger.ledger.exception.PostingRejectedException;
import com.flagship.tenant_ledger.ledger.exception.TenantSuspendedException;
import com.flagship.tenant_ledger.ledger.exception.VoucherNotFoundException;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The posting engine: the single entry point through which every business
 * event reaches the ledger.
 *
 * This service enforces the core invariants:
 * 1. Every voucher balances (debits equal credits, exact integer arithmetic)
 * 2. Every line references an active account of the posting tenant
 * 3. Voucher, lines and outbox event commit atomically, or not at all
 * 4. Voucher numbers are never reused
 *
 * The engine does not know which producer built the request. Manual journal
 * entries use origin MANUAL and go through the same {@link #commit}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccountRepository accountRepository;
    private final VoucherRepository voucherRepository;
    private final LedgerEntryRepository entryRepository;
    private final VoucherNumberAllocator numberAllocator;
    private final PostingWriter postingWriter;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Validates and commits a posting request as one voucher.
     *
     * Steps:
     * 1. Refuse suspended tenants
     * 2. Return the existing voucher if the idempotency key was already used
     * 3. Validate (Empty, Unbalanced, UnknownAccount, InvalidAmount; first failure wins)
     * 4. Allocate the next voucher number in its own committed transaction
     * 5. Write voucher, lines and outbox event under the tenant lock
     *
     * @throws PostingRejectedException on invalid input; nothing is written
     * @throws com.flagship.tenant_ledger.ledger.exception.PostingConflictException
     *         when the tenant lock stays contended after all retries
     */
    public JournalVoucher commit(Tenant tenant, PostingRequest request) {
        Objects.requireNonNull(tenant, "tenant");
        Objects.requireNonNull(request, "request");
        if (tenant.isSuspended()) {
            throw new TenantSuspendedException(tenant.getIdentifier());
        }

        try (MDC.MDCCloseable tenantScope = CorrelationContext.tenantScope(tenant.getIdentifier())) {
            String idempotencyKey = request.getIdempotencyKey();
            if (idempotencyKey != null) {
                Optional<JournalVoucher> existing = findByIdempotencyKey(tenant, idempotencyKey);
                if (existing.isPresent()) {
                    log.info("Idempotency key {} already used, returning voucher {}",
                        idempotencyKey, existing.get().getVoucherNumber());
                    return existing.get();
                }
            }

            Set<UUID> referenced = request.getLines().stream()
                .map(PostingLine::getAccountId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
            Set<UUID> usable = accountRepository.findActiveIds(tenant.getId(), referenced);
            try {
                PostingValidator.validate(request, usable::contains);
            } catch (PostingRejectedException e) {
                ledgerMetrics.recordPostingRejected(e.getErrorCode());
                log.warn("Posting rejected: origin={}, code={}, reason={}",
                    request.getOrigin(), e.getErrorCode(), e.getMessage());
                throw e;
            }

            long sequence = numberAllocator.next(tenant.getId());

            JournalVoucher voucher;
            try {
                voucher = ledgerMetrics.timePosting(() -> postingWriter.write(tenant, request, sequence));
            } catch (DuplicateKeyException e) {
                if (idempotencyKey == null) {
                    throw e;
                }
                // a concurrent request with the same key committed first
                return findByIdempotencyKey(tenant, idempotencyKey).orElseThrow(() -> e);
            } catch (PostingRejectedException e) {
                ledgerMetrics.recordPostingRejected(e.getErrorCode());
                throw e;
            }

            ledgerMetrics.recordVoucherPosted(voucher.getOrigin().name());
            try (MDC.MDCCloseable voucherScope = CorrelationContext.voucherScope(voucher.getVoucherNumber())) {
                log.info("Posted voucher {}: origin={}, date={}, lines={}, amount={}",
                    voucher.getVoucherNumber(), voucher.getOrigin(), voucher.getTransactionDate(),
                    voucher.getEntries().size(), voucher.getTotalDebit());
            }
            return voucher;
        }
    }

    @Transactional(readOnly = true)
    public JournalVoucher findVoucher(Tenant tenant, String voucherNumber) {
        return voucherRepository.findByNumber(tenant.getId(), voucherNumber)
            .map(header -> header.withEntries(entryRepository.findByVoucher(tenant.getId(), header.getId())))
            .orElseThrow(() -> new VoucherNotFoundException(voucherNumber));
    }

    @Transactional(readOnly = true)
    public Optional<JournalVoucher> findByIdempotencyKey(Tenant tenant, String idempotencyKey) {
        return voucherRepository.findByIdempotencyKey(tenant.getId(), idempotencyKey)
            .map(header -> header.withEntries(entryRepository.findByVoucher(tenant.getId(), header.getId())));
    }

    @Transactional(readOnly = true)
    public List<JournalVoucher> listVouchers(Tenant tenant, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return voucherRepository.findByDateRange(tenant.getId(), from, to).stream()
            .map(header -> header.withEntries(entryRepository.findByVoucher(tenant.getId(), header.getId())))
            .toList();
    }
}
