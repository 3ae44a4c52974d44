package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.document.SourceDocument;
import com.flagship.tenant_ledger.document.SourceDocumentStore;
import com.flagship.tenant_ledger.ledger.exception.BooksUnbalancedException;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Derives financial statements from the ledger: trial balance, profit and
 * loss, balance sheet, cash flow, aging and the account ledger.
 *
 * Every method is a pure read in a read-only REPEATABLE READ transaction, so
 * all queries of one statement see the same snapshot and never a half-written
 * voucher. Nothing derived here is cached or stored.
 *
 * A statement that fails its balance check raises {@link BooksUnbalancedException}.
 * That is an integrity alarm: it is logged and counted, never repaired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementService {

    private static final String UNKNOWN_COUNTERPARTY = "(unspecified)";

    private final StatementQueries queries;
    private final ChartOfAccountsService chartOfAccounts;
    private final SourceDocumentStore documentStore;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public TrialBalance trialBalance(Tenant tenant, LocalDate asOf) {
        long start = System.nanoTime();
        List<TrialBalance.Line> lines = new ArrayList<>();
        long totalDebit = 0;
        long totalCredit = 0;
        for (AccountTotals totals : queries.totalsAsOf(tenant.getId(), asOf)) {
            long net = totals.getNetDebit();
            long debit = net > 0 ? net : 0;
            long credit = net < 0 ? -net : 0;
            lines.add(new TrialBalance.Line(totals.getAccountId(), totals.getCode(), totals.getName(),
                totals.getType(), debit, credit));
            totalDebit = Math.addExact(totalDebit, debit);
            totalCredit = Math.addExact(totalCredit, credit);
        }
        if (totalDebit != totalCredit) {
            throw booksUnbalanced(tenant, "Trial balance", totalDebit - totalCredit);
        }
        ledgerMetrics.recordStatementDuration("trial_balance", Duration.ofNanos(System.nanoTime() - start));
        return new TrialBalance(asOf, List.copyOf(lines), totalDebit, totalCredit);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ProfitAndLoss profitAndLoss(Tenant tenant, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        long start = System.nanoTime();
        List<StatementLine> revenue = new ArrayList<>();
        List<StatementLine> expenses = new ArrayList<>();
        long totalRevenue = 0;
        long totalExpenses = 0;
        long costOfSales = 0;
        for (AccountTotals totals : queries.movementsBetween(tenant.getId(), from, to)) {
            if (totals.getType() == AccountType.REVENUE) {
                revenue.add(StatementLine.of(totals));
                totalRevenue = Math.addExact(totalRevenue, totals.getBalance());
            } else if (totals.getType() == AccountType.EXPENSE) {
                expenses.add(StatementLine.of(totals));
                totalExpenses = Math.addExact(totalExpenses, totals.getBalance());
                if (totals.getSystemRole() == SystemAccount.COST_OF_GOODS_SOLD) {
                    costOfSales = totals.getBalance();
                }
            }
        }
        ledgerMetrics.recordStatementDuration("profit_and_loss", Duration.ofNanos(System.nanoTime() - start));
        return new ProfitAndLoss(from, to, List.copyOf(revenue), List.copyOf(expenses),
            totalRevenue, totalExpenses, costOfSales, totalRevenue - costOfSales, totalRevenue - totalExpenses);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public BalanceSheet balanceSheet(Tenant tenant, LocalDate asOf) {
        long start = System.nanoTime();
        List<StatementLine> assets = new ArrayList<>();
        List<StatementLine> liabilities = new ArrayList<>();
        List<StatementLine> equity = new ArrayList<>();
        long totalAssets = 0;
        long totalLiabilities = 0;
        long totalEquity = 0;
        long revenue = 0;
        long expenses = 0;
        for (AccountTotals totals : queries.totalsAsOf(tenant.getId(), asOf)) {
            long balance = totals.getBalance();
            switch (totals.getType()) {
                case ASSET -> {
                    assets.add(StatementLine.of(totals));
                    totalAssets = Math.addExact(totalAssets, balance);
                }
                case LIABILITY -> {
                    liabilities.add(StatementLine.of(totals));
                    totalLiabilities = Math.addExact(totalLiabilities, balance);
                }
                case EQUITY -> {
                    equity.add(StatementLine.of(totals));
                    totalEquity = Math.addExact(totalEquity, balance);
                }
                case REVENUE -> revenue = Math.addExact(revenue, balance);
                case EXPENSE -> expenses = Math.addExact(expenses, balance);
            }
        }
        long currentEarnings = revenue - expenses;
        totalEquity = Math.addExact(totalEquity, currentEarnings);

        long difference = totalAssets - (totalLiabilities + totalEquity);
        if (difference != 0) {
            throw booksUnbalanced(tenant, "Balance sheet", difference);
        }
        ledgerMetrics.recordStatementDuration("balance_sheet", Duration.ofNanos(System.nanoTime() - start));
        return new BalanceSheet(asOf, List.copyOf(assets), List.copyOf(liabilities), List.copyOf(equity),
            currentEarnings, totalAssets, totalLiabilities, totalEquity);
    }

    /**
     * Open receivables or payables as of a date, bucketed by days past due and
     * grouped per counterparty.
     *
     * A document is open when the control account (Accounts Receivable or
     * Accounts Payable) still carries a balance for it. Receipts and payments
     * tagged with the document reduce that balance.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AgingReport agingReport(Tenant tenant, LocalDate asOf, AgingKind kind) {
        long start = System.nanoTime();
        Account control = chartOfAccounts.requireSystemAccount(tenant, kind.getControlAccount());
        Map<String, Long> netBySource = queries.netDebitBySource(
            tenant.getId(), control.getId(), kind.getDocumentType(), asOf);

        Map<String, List<AgingReport.Item>> byCounterparty = new TreeMap<>();
        for (SourceDocument document : documentStore.findIssuedOnOrBefore(tenant.getId(), kind.getDocumentType(), asOf)) {
            long open = kind.openAmount(netBySource.getOrDefault(document.getDocumentId(), 0L));
            if (open <= 0) {
                continue;
            }
            long daysPastDue = ChronoUnit.DAYS.between(document.getDueDate(), asOf);
            AgingReport.Item item = new AgingReport.Item(document.getDocumentId(), document.getDocumentDate(),
                document.getDueDate(), document.getTotal(), open, daysPastDue, AgingBucket.forDaysPastDue(daysPastDue));
            String counterparty = document.getCounterparty() != null ? document.getCounterparty() : UNKNOWN_COUNTERPARTY;
            byCounterparty.computeIfAbsent(counterparty, key -> new ArrayList<>()).add(item);
        }

        Map<AgingBucket, Long> bucketTotals = emptyBuckets();
        List<AgingReport.CounterpartyAging> counterparties = new ArrayList<>();
        long totalOpen = 0;
        for (Map.Entry<String, List<AgingReport.Item>> entry : byCounterparty.entrySet()) {
            Map<AgingBucket, Long> buckets = emptyBuckets();
            long total = 0;
            for (AgingReport.Item item : entry.getValue()) {
                buckets.merge(item.getBucket(), item.getOpenBalance(), Long::sum);
                bucketTotals.merge(item.getBucket(), item.getOpenBalance(), Long::sum);
                total += item.getOpenBalance();
            }
            totalOpen += total;
            counterparties.add(new AgingReport.CounterpartyAging(entry.getKey(), List.copyOf(entry.getValue()),
                buckets, total));
        }
        ledgerMetrics.recordStatementDuration("aging", Duration.ofNanos(System.nanoTime() - start));
        return new AgingReport(asOf, kind, List.copyOf(counterparties), bucketTotals, totalOpen);
    }

    /**
     * Cash flow over the tenant's Cash and Bank system accounts.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CashFlowStatement cashFlow(Tenant tenant, LocalDate from, LocalDate to) {
        return cashFlow(tenant, from, to, List.of(
            chartOfAccounts.requireSystemAccount(tenant, SystemAccount.CASH).getId(),
            chartOfAccounts.requireSystemAccount(tenant, SystemAccount.BANK).getId()));
    }

    /**
     * Cash flow over an explicit set of asset accounts, for tenants that keep
     * more than one bank account.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CashFlowStatement cashFlow(Tenant tenant, LocalDate from, LocalDate to, Collection<UUID> cashAccountIds) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        if (cashAccountIds.isEmpty()) {
            throw new IllegalArgumentException("At least one cash account is required");
        }
        Set<UUID> accounts = new LinkedHashSet<>(cashAccountIds);
        for (UUID accountId : accounts) {
            Account account = chartOfAccounts.requireAccount(tenant, accountId);
            if (account.getType() != AccountType.ASSET) {
                throw new IllegalArgumentException("Cash flow accounts must be asset accounts: " + account.getName());
            }
        }

        long start = System.nanoTime();
        long opening = queries.netDebitBefore(tenant.getId(), accounts, from);
        List<CashFlowStatement.Activity> activities = queries.cashActivityBetween(tenant.getId(), accounts, from, to);
        long inflows = 0;
        long outflows = 0;
        for (CashFlowStatement.Activity activity : activities) {
            inflows = Math.addExact(inflows, activity.getInflows());
            outflows = Math.addExact(outflows, activity.getOutflows());
        }
        long netChange = inflows - outflows;
        ledgerMetrics.recordStatementDuration("cash_flow", Duration.ofNanos(System.nanoTime() - start));
        return new CashFlowStatement(from, to, List.copyOf(accounts), opening, List.copyOf(activities),
            inflows, outflows, netChange, Math.addExact(opening, netChange));
    }

    /**
     * Balance of one account as of a date, in its normal-balance sign.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public long accountBalance(Tenant tenant, UUID accountId, LocalDate asOf) {
        Account account = chartOfAccounts.requireAccount(tenant, accountId);
        long[] totals = queries.totalsBefore(tenant.getId(), accountId, asOf.plusDays(1));
        return account.getType().signedBalance(totals[0], totals[1]);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AccountLedger accountLedger(Tenant tenant, UUID accountId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Account account = chartOfAccounts.requireAccount(tenant, accountId);
        long[] opening = queries.totalsBefore(tenant.getId(), accountId, from);
        long openingBalance = account.getType().signedBalance(opening[0], opening[1]);

        long running = openingBalance;
        List<AccountLedger.Line> lines = new ArrayList<>();
        for (AccountLedger.Line line : queries.entriesBetween(tenant.getId(), accountId, from, to)) {
            running = Math.addExact(running, account.getType().signedBalance(line.getDebit(), line.getCredit()));
            lines.add(line.withRunningBalance(running));
        }
        return new AccountLedger(account, from, to, openingBalance, List.copyOf(lines), running);
    }

    private BooksUnbalancedException booksUnbalanced(Tenant tenant, String statement, long difference) {
        log.error("INTEGRITY ALARM: {} for tenant {} ({}) is out of balance by {}",
            statement, tenant.getIdentifier(), tenant.getId(), difference);
        ledgerMetrics.recordBooksUnbalanced(statement);
        return new BooksUnbalancedException(tenant.getId(), statement, difference);
    }

    private static Map<AgingBucket, Long> emptyBuckets() {
        Map<AgingBucket, Long> buckets = new EnumMap<>(AgingBucket.class);
        for (AgingBucket bucket : AgingBucket.values()) {
            buckets.put(bucket, 0L);
        }
        return buckets;
    }
}
