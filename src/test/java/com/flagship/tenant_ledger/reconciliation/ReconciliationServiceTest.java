package com.flagship.tenant_ledger.reconciliation;

import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;
import com.flagship.tenant_ledger.ledger.exception.InvalidTransferException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.statement.AccountLedger;
import com.flagship.tenant_ledger.statement.StatementService;
import com.flagship.tenant_ledger.support.IntegrationTestSupport;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bank reconciliation against statement snapshots.
 *
 * Bank movements used throughout:
 * - Mar 1:  +50,000
 * - Mar 5:  -20,000
 * - Mar 20:  +5,000
 */
class ReconciliationServiceTest extends IntegrationTestSupport {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private StatementService statementService;

    private Tenant tenant;
    private UUID bank;
    private UUID capital;

    @BeforeEach
    void setUp() {
        tenant = newTenant();
        bank = systemAccount(tenant, SystemAccount.BANK);
        capital = systemAccount(tenant, SystemAccount.OWNERS_CAPITAL);
        UUID charges = systemAccount(tenant, SystemAccount.BANK_CHARGES);

        post(LocalDate.of(2024, 3, 1), PostingLine.debit(bank, 50_000, "Deposit"),
            PostingLine.credit(capital, 50_000, null));
        post(LocalDate.of(2024, 3, 5), PostingLine.debit(charges, 20_000, null),
            PostingLine.credit(bank, 20_000, "Withdrawal"));
        post(LocalDate.of(2024, 3, 20), PostingLine.debit(bank, 5_000, "Deposit"),
            PostingLine.credit(capital, 5_000, null));
    }

    private JournalVoucher post(LocalDate date, PostingLine debit, PostingLine credit) {
        return ledgerService.commit(tenant, PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(date)
            .line(debit)
            .line(credit)
            .build());
    }

    @Test
    @DisplayName("Statement matching the book reconciles every entry up to its date")
    void matchingStatement() {
        printTestHeader("Matched reconciliation");
        StatementSnapshot snapshot = new StatementSnapshot(LocalDate.of(2024, 3, 10), 30_000);
        printInput("Snapshot", snapshot);

        ReconciliationResult result = reconciliationService.reconcile(tenant, bank, snapshot);

        printOutput("Result", result);
        assertTrue(result.isMatched());
        assertEquals(2, result.getMatchedEntries().size());
        assertEquals(30_000, result.getMatchedTotal());
        assertEquals(0, result.getDiscrepancy());

        AccountLedger ledger = statementService.accountLedger(tenant, bank,
            LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        assertTrue(ledger.getLines().get(0).isReconciled());
        assertTrue(ledger.getLines().get(1).isReconciled());
        assertFalse(ledger.getLines().get(2).isReconciled());
    }

    @Test
    @DisplayName("Later statement only picks up entries not yet reconciled")
    void successiveStatements() {
        reconciliationService.reconcile(tenant, bank, new StatementSnapshot(LocalDate.of(2024, 3, 10), 30_000));

        ReconciliationResult second = reconciliationService.reconcile(tenant, bank,
            new StatementSnapshot(LocalDate.of(2024, 3, 31), 35_000));

        assertTrue(second.isMatched());
        assertEquals(1, second.getMatchedEntries().size());
        assertEquals(5_000, second.getMatchedTotal());

        List<ReconciliationBatch> batches = reconciliationService.findBatches(tenant, bank);
        assertEquals(2, batches.size());
        assertEquals(2, batches.get(0).getEntryCount());
        assertEquals(1, batches.get(1).getEntryCount());
    }

    @Test
    @DisplayName("Statement matching an earlier prefix leaves later entries open")
    void prefixMatch() {
        ReconciliationResult result = reconciliationService.reconcile(tenant, bank,
            new StatementSnapshot(LocalDate.of(2024, 3, 31), 30_000));

        assertTrue(result.isMatched());
        assertEquals(2, result.getMatchedEntries().size());
    }

    @Test
    @DisplayName("Unmatched statement is recorded as a discrepancy, and a correction clears it")
    void discrepancyThenCorrection() {
        printTestHeader("Discrepancy and correction");
        StatementSnapshot snapshot = new StatementSnapshot(LocalDate.of(2024, 3, 31), 35_250);

        ReconciliationResult discrepancy = reconciliationService.reconcile(tenant, bank, snapshot);

        printOutput("First attempt", discrepancy);
        assertFalse(discrepancy.isMatched());
        assertEquals(ReconciliationStatus.DISCREPANCY, discrepancy.getStatus());
        assertEquals(250, discrepancy.getDiscrepancy());
        assertTrue(discrepancy.getMatchedEntries().isEmpty());

        JournalVoucher correction = reconciliationService.postCorrection(tenant, bank,
            systemAccount(tenant, SystemAccount.OTHER_INCOME), 250, LocalDate.of(2024, 3, 31), "Interest credited");
        assertEquals(OriginModule.RECONCILIATION, correction.getOrigin());

        ReconciliationResult retry = reconciliationService.reconcile(tenant, bank, snapshot);

        printOutput("After correction", retry);
        assertTrue(retry.isMatched());
        assertEquals(4, retry.getMatchedEntries().size());
        assertEquals(35_250, statementService.accountBalance(tenant, bank, LocalDate.of(2024, 3, 31)));
    }

    @Test
    @DisplayName("Negative correction lowers the balance")
    void negativeCorrection() {
        reconciliationService.postCorrection(tenant, bank,
            systemAccount(tenant, SystemAccount.BANK_CHARGES), -1_000, LocalDate.of(2024, 3, 31), "Fees");

        assertEquals(34_000, statementService.accountBalance(tenant, bank, LocalDate.of(2024, 3, 31)));
    }

    @Test
    void correctionRejectsBadInput() {
        assertThrows(InvalidTransferException.class, () -> reconciliationService.postCorrection(
            tenant, bank, bank, 100, LocalDate.of(2024, 3, 31), null));
        assertThrows(InvalidAmountException.class, () -> reconciliationService.postCorrection(
            tenant, bank, capital, 0, LocalDate.of(2024, 3, 31), null));
    }

    @Test
    @DisplayName("Another tenant's account cannot be reconciled")
    void accountIsTenantScoped() {
        Tenant other = newTenant();

        assertThrows(UnknownAccountException.class, () -> reconciliationService.reconcile(other, bank,
            new StatementSnapshot(LocalDate.of(2024, 3, 31), 35_000)));
    }
}
