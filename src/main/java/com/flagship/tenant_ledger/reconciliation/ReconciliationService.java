package com.flagship.tenant_ledger.reconciliation;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerEntryRepository;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.TenantLock;
import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;
import com.flagship.tenant_ledger.ledger.exception.InvalidTransferException;
import com.flagship.tenant_ledger.ledger.exception.PostingConflictException;
import com.flagship.tenant_ledger.ledger.exception.TenantSuspendedException;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Matches an account's ledger entries against a bank statement.
 *
 * A match attaches entries to a new batch, permanently. A mismatch records a
 * DISCREPANCY batch and attaches nothing; the ledger is never adjusted
 * behind the user's back. Corrections are explicit vouchers posted through
 * {@link #postCorrection}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final ReconciliationRepository reconciliationRepository;
    private final LedgerEntryRepository entryRepository;
    private final ChartOfAccountsService chartOfAccounts;
    private final LedgerService ledgerService;
    private final TenantLock tenantLock;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public ReconciliationResult reconcile(Tenant tenant, UUID accountId, StatementSnapshot snapshot) {
        if (tenant.isSuspended()) {
            throw new TenantSuspendedException(tenant.getIdentifier());
        }
        Account account = chartOfAccounts.requireAccount(tenant, accountId);
        // keeps a concurrent reconciliation from attaching the same entries
        tenantLock.acquire(tenant.getId());

        AccountType type = account.getType();
        long[] reconciled = reconciliationRepository.reconciledTotals(tenant.getId(), accountId);
        long reconciledBalance = type.signedBalance(reconciled[0], reconciled[1]);

        List<LedgerEntry> candidates = entryRepository.findUnreconciled(
            tenant.getId(), accountId, snapshot.getStatementDate());
        List<Long> movements = candidates.stream()
            .map(entry -> type.signedBalance(entry.getDebit(), entry.getCredit()))
            .toList();

        ReconciliationMatcher.Match match =
            ReconciliationMatcher.match(reconciledBalance, movements, snapshot.getClosingBalance());

        UUID batchId = UUID.randomUUID();
        if (!match.found()) {
            long discrepancy = snapshot.getClosingBalance() - match.bookBalance();
            reconciliationRepository.insert(new ReconciliationBatch(batchId, tenant.getId(), accountId,
                snapshot.getStatementDate(), snapshot.getClosingBalance(), 0L, discrepancy, 0,
                ReconciliationStatus.DISCREPANCY, Instant.now()));
            ledgerMetrics.recordReconciliation(ReconciliationStatus.DISCREPANCY.name());
            log.warn("Reconciliation of account {} for tenant {} on {} found a discrepancy of {} " +
                    "(statement={}, book={})", accountId, tenant.getIdentifier(), snapshot.getStatementDate(),
                discrepancy, snapshot.getClosingBalance(), match.bookBalance());
            return new ReconciliationResult(batchId, ReconciliationStatus.DISCREPANCY, List.of(), 0L, discrepancy);
        }

        List<UUID> matched = candidates.subList(0, match.matchedCount()).stream()
            .map(LedgerEntry::getId)
            .toList();
        reconciliationRepository.insert(new ReconciliationBatch(batchId, tenant.getId(), accountId,
            snapshot.getStatementDate(), snapshot.getClosingBalance(), match.matchedTotal(), 0L, matched.size(),
            ReconciliationStatus.MATCHED, Instant.now()));
        int attached = entryRepository.attachToBatch(tenant.getId(), batchId, matched);
        if (attached != matched.size()) {
            // some entry was reconciled elsewhere since it was read
            throw new PostingConflictException(tenant.getId(), null);
        }

        ledgerMetrics.recordReconciliation(ReconciliationStatus.MATCHED.name());
        log.info("Reconciled {} entries on account {} for tenant {} up to {} (matched total {})",
            matched.size(), accountId, tenant.getIdentifier(), snapshot.getStatementDate(), match.matchedTotal());
        return new ReconciliationResult(batchId, ReconciliationStatus.MATCHED, matched, match.matchedTotal(), 0L);
    }

    @Transactional(readOnly = true)
    public List<ReconciliationBatch> findBatches(Tenant tenant, UUID accountId) {
        chartOfAccounts.requireAccount(tenant, accountId);
        return reconciliationRepository.findByAccount(tenant.getId(), accountId);
    }

    /**
     * Posts a corrective voucher for a discrepancy.
     *
     * @param amount change to the account's balance in its normal-balance sign;
     *               positive raises the balance, negative lowers it
     */
    public JournalVoucher postCorrection(Tenant tenant, UUID accountId, UUID offsetAccountId,
                                         long amount, LocalDate date, String note) {
        if (accountId.equals(offsetAccountId)) {
            throw new InvalidTransferException(accountId);
        }
        if (amount == 0 || amount == Long.MIN_VALUE) {
            throw new InvalidAmountException("Correction amount must be nonzero");
        }
        Account account = chartOfAccounts.requireAccount(tenant, accountId);
        long magnitude = Math.abs(amount);
        boolean debitAccount = (amount > 0) == (account.getType().signedBalance(1, 0) > 0);

        PostingRequest request = PostingRequest.builder()
            .origin(OriginModule.RECONCILIATION)
            .transactionDate(date)
            .note(note != null ? note : "Reconciliation correction")
            .line(debitAccount
                ? PostingLine.debit(accountId, magnitude, note)
                : PostingLine.credit(accountId, magnitude, note))
            .line(debitAccount
                ? PostingLine.credit(offsetAccountId, magnitude, note)
                : PostingLine.debit(offsetAccountId, magnitude, note))
            .build();
        JournalVoucher voucher = ledgerService.commit(tenant, request);
        log.info("Posted reconciliation correction {} of {} on account {} for tenant {}",
            voucher.getVoucherNumber(), amount, accountId, tenant.getIdentifier());
        return voucher;
    }
}
