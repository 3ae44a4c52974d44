package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.account.AccountRepository;
import com.flagship.tenant_ledger.ledger.event.VoucherPostedEvent;
import com.flagship.tenant_ledger.ledger.exception.PostingConflictException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.outbox.OutboxService;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes one validated posting as a voucher, inside the tenant's lock.
 *
 * In one database transaction:
 * 1. Take the tenant's advisory lock
 * 2. Re-check the accounts (one may have been deactivated since validation)
 * 3. Insert the voucher header and its lines
 * 4. Write the VoucherPosted event to the outbox
 *
 * A deferred constraint trigger re-checks the voucher balance at commit.
 * Contention is retried here with exponential backoff; each attempt runs in
 * a new transaction because the retry advice wraps the transaction advice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class PostingWriter {

    private final TenantLock tenantLock;
    private final AccountRepository accountRepository;
    private final VoucherRepository voucherRepository;
    private final LedgerEntryRepository entryRepository;
    private final OutboxService outboxService;

    @Retryable(
        retryFor = PostingConflictException.class,
        maxAttemptsExpression = "${ledger.posting.max-attempts:4}",
        backoff = @Backoff(
            delayExpression = "${ledger.posting.retry-delay-ms:50}",
            multiplierExpression = "${ledger.posting.retry-multiplier:2}",
            maxDelayExpression = "${ledger.posting.retry-max-delay-ms:1000}"))
    @Transactional
    public JournalVoucher write(Tenant tenant, PostingRequest request, long sequence) {
        UUID tenantId = tenant.getId();
        tenantLock.acquire(tenantId);

        Set<UUID> referenced = request.getLines().stream()
            .map(PostingLine::getAccountId)
            .collect(Collectors.toSet());
        Set<UUID> usable = accountRepository.findActiveIds(tenantId, referenced);
        for (UUID accountId : referenced) {
            if (!usable.contains(accountId)) {
                throw new UnknownAccountException(accountId);
            }
        }

        UUID voucherId = UUID.randomUUID();
        VoucherHeader header = new VoucherHeader(
            voucherId,
            tenantId,
            VoucherNumbers.format(request.getTransactionDate(), sequence),
            sequence,
            request.getTransactionDate(),
            request.getNote(),
            request.getOrigin(),
            request.getSourceDocument(),
            request.getIdempotencyKey(),
            Instant.now()
        );

        List<LedgerEntry> entries = new ArrayList<>(request.getLines().size());
        int lineNumber = 1;
        for (PostingLine line : request.getLines()) {
            entries.add(new LedgerEntry(
                UUID.randomUUID(),
                tenantId,
                voucherId,
                lineNumber++,
                line.getAccountId(),
                request.getTransactionDate(),
                line.getDebit(),
                line.getCredit(),
                line.getDescription(),
                request.getSourceDocument(),
                null
            ));
        }

        try {
            voucherRepository.insert(header);
            entryRepository.insertAll(entries);
        } catch (PessimisticLockingFailureException e) {
            throw new PostingConflictException(tenantId, e);
        }

        JournalVoucher voucher = header.withEntries(entries);
        outboxService.saveEvent(tenantId, VoucherPostedEvent.AGGREGATE_TYPE, voucherId,
            VoucherPostedEvent.EVENT_TYPE, VoucherPostedEvent.fromVoucher(voucher));

        log.debug("Wrote voucher {} with {} lines for tenant {}",
            header.getVoucherNumber(), entries.size(), tenant.getIdentifier());
        return voucher;
    }
}
