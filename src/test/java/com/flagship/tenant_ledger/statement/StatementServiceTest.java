package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.exception.BooksUnbalancedException;
import com.flagship.tenant_ledger.posting.CustomerReceiptPostingProducer;
import com.flagship.tenant_ledger.posting.DocumentSettlement;
import com.flagship.tenant_ledger.posting.ExpensePostingProducer;
import com.flagship.tenant_ledger.posting.ExpenseRecord;
import com.flagship.tenant_ledger.posting.FundTransfer;
import com.flagship.tenant_ledger.posting.FundTransferPostingProducer;
import com.flagship.tenant_ledger.posting.PurchaseBill;
import com.flagship.tenant_ledger.posting.PurchaseBillPostingProducer;
import com.flagship.tenant_ledger.posting.SalesInvoice;
import com.flagship.tenant_ledger.posting.SalesInvoicePostingProducer;
import com.flagship.tenant_ledger.support.IntegrationTestSupport;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Statements derived from the ledger: trial balance, profit and loss,
 * balance sheet, cash flow, aging and the account ledger.
 */
class StatementServiceTest extends IntegrationTestSupport {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate MARCH_31 = LocalDate.of(2024, 3, 31);

    @Autowired
    private StatementService statementService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private SalesInvoicePostingProducer salesInvoices;

    @Autowired
    private CustomerReceiptPostingProducer customerReceipts;

    @Autowired
    private PurchaseBillPostingProducer purchaseBills;

    @Autowired
    private ExpensePostingProducer expenses;

    @Autowired
    private FundTransferPostingProducer fundTransfers;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private MeterRegistry meterRegistry;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = newTenant();
    }

    private SalesInvoice.SalesInvoiceBuilder invoice(String id) {
        return SalesInvoice.builder()
            .invoiceId(id)
            .customer("Kola Stores")
            .invoiceDate(MARCH_1)
            .dueDate(MARCH_31)
            .vatRatePercent(new BigDecimal("15"));
    }

    private TrialBalance.Line lineFor(TrialBalance trialBalance, SystemAccount role) {
        UUID accountId = systemAccount(tenant, role);
        return trialBalance.getLines().stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("Trial balance")
    class TrialBalanceTests {

        @Test
        @DisplayName("Sales invoice of 11,500 with 15% VAT shows in the trial balance")
        void salesInvoiceScenario() {
            printTestHeader("Trial balance after a sales invoice");
            salesInvoices.post(tenant, invoice("INV-001").subtotal(10_000).build());

            TrialBalance trialBalance = statementService.trialBalance(tenant, MARCH_31);

            TrialBalance.Line receivable = lineFor(trialBalance, SystemAccount.ACCOUNTS_RECEIVABLE);
            TrialBalance.Line revenue = lineFor(trialBalance, SystemAccount.SALES_REVENUE);
            TrialBalance.Line vat = lineFor(trialBalance, SystemAccount.VAT_PAYABLE);
            printOutput("Receivable", receivable);
            printOutput("Revenue", revenue);
            printOutput("VAT", vat);

            assertEquals(11_500, receivable.getDebit());
            assertEquals(0, receivable.getCredit());
            assertEquals(10_000, revenue.getCredit());
            assertEquals(1_500, vat.getCredit());
            assertEquals(11_500, trialBalance.getTotalDebit());
            assertEquals(11_500, trialBalance.getTotalCredit());
            assertTrue(trialBalance.isBalanced());
            printSuccess("Trial balance nets to zero");
        }

        @Test
        @DisplayName("Entries after the as-of date are excluded")
        void asOfExcludesLaterEntries() {
            salesInvoices.post(tenant, invoice("INV-001").subtotal(10_000).build());
            salesInvoices.post(tenant, invoice("INV-002").invoiceDate(LocalDate.of(2024, 4, 2)).subtotal(20_000).build());

            assertEquals(11_500, statementService.trialBalance(tenant, MARCH_31).getTotalDebit());
            assertEquals(34_500, statementService.trialBalance(tenant, LocalDate.of(2024, 4, 30)).getTotalDebit());
            assertEquals(0, statementService.trialBalance(tenant, LocalDate.of(2024, 2, 29)).getTotalDebit());
        }
    }

    @Test
    @DisplayName("Profit and loss separates cost of sales and other expenses")
    void profitAndLoss() {
        printTestHeader("Profit and loss");
        Account rent = chartOfAccounts.createAccount(tenant, "6100", "Rent", AccountType.EXPENSE);
        salesInvoices.post(tenant, invoice("INV-001").subtotal(100_000).costOfGoods(60_000).build());
        expenses.post(tenant, ExpenseRecord.builder()
            .expenseId("EXP-1").expenseDate(LocalDate.of(2024, 3, 5))
            .expenseAccountId(rent.getId()).amount(15_000).description("March rent")
            .build());
        // outside the period
        expenses.post(tenant, ExpenseRecord.builder()
            .expenseId("EXP-2").expenseDate(LocalDate.of(2024, 4, 5))
            .expenseAccountId(rent.getId()).amount(15_000)
            .build());

        ProfitAndLoss pnl = statementService.profitAndLoss(tenant, MARCH_1, MARCH_31);

        printOutput("Revenue", pnl.getTotalRevenue());
        printOutput("Expenses", pnl.getTotalExpenses());
        printOutput("Net income", pnl.getNetIncome());
        assertEquals(100_000, pnl.getTotalRevenue());
        assertEquals(60_000, pnl.getCostOfSales());
        assertEquals(40_000, pnl.getGrossProfit());
        assertEquals(75_000, pnl.getTotalExpenses());
        assertEquals(25_000, pnl.getNetIncome());
    }

    @Test
    void profitAndLossRejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class,
            () -> statementService.profitAndLoss(tenant, MARCH_31, MARCH_1));
    }

    @Test
    @DisplayName("Balance sheet balances with current earnings in equity")
    void balanceSheetBalances() {
        printTestHeader("Balance sheet");
        ledgerService.commit(tenant, PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(MARCH_1)
            .line(PostingLine.debit(systemAccount(tenant, SystemAccount.BANK), 1_000_000, null))
            .line(PostingLine.credit(systemAccount(tenant, SystemAccount.OWNERS_CAPITAL), 1_000_000, null))
            .build());
        purchaseBills.post(tenant, PurchaseBill.builder()
            .billId("BILL-1").supplier("Dangote Ltd").billDate(MARCH_1).dueDate(MARCH_31)
            .subtotal(200_000).vatRatePercent(new BigDecimal("7.5"))
            .build());
        salesInvoices.post(tenant, invoice("INV-001").subtotal(300_000).costOfGoods(120_000).build());

        BalanceSheet sheet = statementService.balanceSheet(tenant, MARCH_31);

        printOutput("Assets", sheet.getTotalAssets());
        printOutput("Liabilities + equity", sheet.getTotalLiabilitiesAndEquity());
        assertEquals(sheet.getTotalAssets(), sheet.getTotalLiabilitiesAndEquity());
        assertEquals(180_000, sheet.getCurrentEarnings());
        // bank 1,000,000 + inventory 80,000 + VAT refundable 15,000 + receivable 345,000
        assertEquals(1_440_000, sheet.getTotalAssets());
        // payable 215,000 + VAT payable 45,000
        assertEquals(260_000, sheet.getTotalLiabilities());
        assertEquals(1_180_000, sheet.getTotalEquity());
    }

    @Test
    @DisplayName("Empty ledger produces zero statements")
    void emptyLedger() {
        BalanceSheet sheet = statementService.balanceSheet(tenant, MARCH_31);
        TrialBalance trialBalance = statementService.trialBalance(tenant, MARCH_31);

        assertEquals(0, sheet.getTotalAssets());
        assertEquals(0, sheet.getCurrentEarnings());
        assertTrue(trialBalance.isBalanced());
        assertEquals(0, trialBalance.getTotalDebit());
    }

    @Nested
    @DisplayName("Aging")
    class Aging {

        @Test
        @DisplayName("Open invoices are bucketed by days past due, net of receipts")
        void receivablesAging() {
            printTestHeader("Receivables aging");
            salesInvoices.post(tenant, invoice("INV-001").customer("Kola Stores")
                .invoiceDate(LocalDate.of(2024, 1, 1)).dueDate(LocalDate.of(2024, 1, 15))
                .subtotal(10_000).build());
            salesInvoices.post(tenant, invoice("INV-002").customer("Kola Stores")
                .invoiceDate(LocalDate.of(2024, 3, 1)).dueDate(LocalDate.of(2024, 4, 30))
                .subtotal(20_000).build());
            salesInvoices.post(tenant, invoice("INV-003").customer("Ade Ventures")
                .invoiceDate(LocalDate.of(2024, 2, 1)).dueDate(LocalDate.of(2024, 2, 15))
                .subtotal(40_000).build());
            // fully paid
            salesInvoices.post(tenant, invoice("INV-004").customer("Ade Ventures")
                .invoiceDate(LocalDate.of(2024, 2, 1)).dueDate(LocalDate.of(2024, 2, 15))
                .subtotal(5_000).build());
            customerReceipts.post(tenant, DocumentSettlement.builder()
                .documentId("INV-004").settlementDate(LocalDate.of(2024, 2, 20)).amount(5_750).build());
            // partly paid
            customerReceipts.post(tenant, DocumentSettlement.builder()
                .documentId("INV-003").settlementDate(LocalDate.of(2024, 2, 20)).amount(6_000).build());
            // cash sale never appears
            salesInvoices.post(tenant, invoice("INV-005").cashSale(true).subtotal(1_000).build());

            AgingReport report = statementService.agingReport(tenant, MARCH_31, AgingKind.RECEIVABLES);

            printOutput("Counterparties", report.getCounterparties().size());
            printOutput("Bucket totals", report.getBucketTotals());
            assertEquals(2, report.getCounterparties().size());
            AgingReport.CounterpartyAging ade = report.getCounterparties().get(0);
            AgingReport.CounterpartyAging kola = report.getCounterparties().get(1);
            assertEquals("Ade Ventures", ade.getCounterparty());
            assertEquals(1, ade.getDocuments().size());
            assertEquals(40_000, ade.getDocuments().get(0).getOpenBalance());
            assertEquals(45, ade.getDocuments().get(0).getDaysPastDue());
            assertEquals(AgingBucket.DAYS_31_60, ade.getDocuments().get(0).getBucket());

            assertEquals("Kola Stores", kola.getCounterparty());
            assertEquals(76, kola.getDocuments().get(0).getDaysPastDue());
            assertEquals(11_500, kola.getBuckets().get(AgingBucket.DAYS_61_90));
            assertEquals(23_000, kola.getBuckets().get(AgingBucket.CURRENT));
            assertEquals(34_500, kola.getTotal());

            assertEquals(74_500, report.getTotalOpen());
            assertEquals(0L, report.getBucketTotals().get(AgingBucket.OVER_90));
        }

        @Test
        @DisplayName("Unpaid bills show on the payables aging")
        void payablesAging() {
            purchaseBills.post(tenant, PurchaseBill.builder()
                .billId("BILL-9").supplier("Dangote Ltd").billDate(LocalDate.of(2023, 10, 1))
                .dueDate(LocalDate.of(2023, 10, 31)).subtotal(50_000)
                .build());

            AgingReport report = statementService.agingReport(tenant, MARCH_31, AgingKind.PAYABLES);

            assertEquals(50_000, report.getTotalOpen());
            assertEquals(50_000L, report.getBucketTotals().get(AgingBucket.OVER_90));
        }
    }

    @Test
    @DisplayName("Account ledger carries an opening and running balance")
    void accountLedger() {
        UUID bank = systemAccount(tenant, SystemAccount.BANK);
        UUID capital = systemAccount(tenant, SystemAccount.OWNERS_CAPITAL);
        ledgerService.commit(tenant, PostingRequest.builder()
            .origin(OriginModule.MANUAL).transactionDate(LocalDate.of(2024, 2, 10))
            .line(PostingLine.debit(bank, 50_000, "opening funds"))
            .line(PostingLine.credit(capital, 50_000, null))
            .build());
        ledgerService.commit(tenant, PostingRequest.builder()
            .origin(OriginModule.MANUAL).transactionDate(LocalDate.of(2024, 3, 3))
            .line(PostingLine.debit(bank, 20_000, "more funds"))
            .line(PostingLine.credit(capital, 20_000, null))
            .build());
        expenses.post(tenant, ExpenseRecord.builder()
            .expenseId("EXP-7").expenseDate(LocalDate.of(2024, 3, 9))
            .expenseAccountId(systemAccount(tenant, SystemAccount.BANK_CHARGES))
            .paymentAccountId(bank).amount(500)
            .build());

        AccountLedger ledger = statementService.accountLedger(tenant, bank, MARCH_1, MARCH_31);

        assertEquals(50_000, ledger.getOpeningBalance());
        assertEquals(2, ledger.getLines().size());
        assertEquals(70_000, ledger.getLines().get(0).getRunningBalance());
        assertEquals(69_500, ledger.getLines().get(1).getRunningBalance());
        assertEquals(69_500, ledger.getClosingBalance());
        assertEquals(69_500, statementService.accountBalance(tenant, bank, MARCH_31));
    }

    @Nested
    @DisplayName("Cash flow")
    class CashFlow {

        @Test
        @DisplayName("Cash and bank movements are grouped by origin; internal transfers drop out")
        void cashFlowByOrigin() {
            printTestHeader("Cash flow statement");
            UUID cash = systemAccount(tenant, SystemAccount.CASH);
            UUID bank = systemAccount(tenant, SystemAccount.BANK);
            ledgerService.commit(tenant, PostingRequest.builder()
                .origin(OriginModule.MANUAL).transactionDate(LocalDate.of(2024, 2, 10))
                .line(PostingLine.debit(bank, 50_000, "opening funds"))
                .line(PostingLine.credit(systemAccount(tenant, SystemAccount.OWNERS_CAPITAL), 50_000, null))
                .build());
            salesInvoices.post(tenant, invoice("CS-1").cashSale(true).invoiceDate(LocalDate.of(2024, 3, 3))
                .subtotal(10_000).build());
            expenses.post(tenant, ExpenseRecord.builder()
                .expenseId("EXP-1").expenseDate(LocalDate.of(2024, 3, 5))
                .expenseAccountId(systemAccount(tenant, SystemAccount.BANK_CHARGES)).amount(2_000)
                .build());
            fundTransfers.post(tenant, FundTransfer.builder()
                .transferId("TR-1").transferDate(LocalDate.of(2024, 3, 10))
                .sourceAccountId(bank).destinationAccountId(cash).amount(5_000)
                .build());
            // after the period
            expenses.post(tenant, ExpenseRecord.builder()
                .expenseId("EXP-2").expenseDate(LocalDate.of(2024, 4, 2))
                .expenseAccountId(systemAccount(tenant, SystemAccount.BANK_CHARGES)).amount(700)
                .build());

            CashFlowStatement statement = statementService.cashFlow(tenant, MARCH_1, MARCH_31);
            printOutput("Activities", statement.getActivities());

            assertEquals(50_000, statement.getOpeningBalance());
            assertEquals(2, statement.getActivities().size());
            assertEquals(OriginModule.EXPENSE, statement.getActivities().get(0).getOrigin());
            assertEquals(2_000, statement.getActivities().get(0).getOutflows());
            assertEquals(OriginModule.SALES, statement.getActivities().get(1).getOrigin());
            assertEquals(11_500, statement.getActivities().get(1).getInflows());
            assertEquals(11_500, statement.getTotalInflows());
            assertEquals(2_000, statement.getTotalOutflows());
            assertEquals(9_500, statement.getNetChange());
            assertEquals(59_500, statement.getClosingBalance());
            assertEquals(statement.getClosingBalance(), statementService.accountBalance(tenant, cash, MARCH_31)
                + statementService.accountBalance(tenant, bank, MARCH_31));
            printSuccess("Closing cash agrees with the account balances");
        }

        @Test
        void onlyAssetAccountsAreAccepted() {
            UUID revenue = systemAccount(tenant, SystemAccount.SALES_REVENUE);

            assertThrows(IllegalArgumentException.class,
                () -> statementService.cashFlow(tenant, MARCH_1, MARCH_31, List.of(revenue)));
            assertThrows(IllegalArgumentException.class,
                () -> statementService.cashFlow(tenant, MARCH_31, MARCH_1));
        }
    }

    @Nested
    @DisplayName("Integrity alarm")
    class IntegrityAlarm {

        /**
         * Writes a one-sided voucher with triggers switched off for the
         * transaction, as a faulty migration or manual fix might.
         */
        private void writeUnbalancedVoucherAroundTheEngine() {
            UUID voucherId = UUID.randomUUID();
            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                jdbcTemplate.execute("SET LOCAL session_replication_role = replica");
                jdbcTemplate.update("INSERT INTO journal_vouchers (id, tenant_id, voucher_number, sequence_number, " +
                        "transaction_date, origin) VALUES (?, ?, 'JV-2024-900001', 900001, ?, 'MANUAL')",
                    voucherId, tenant.getId(), MARCH_1);
                jdbcTemplate.update("INSERT INTO ledger_entries (id, tenant_id, voucher_id, line_number, account_id, " +
                        "transaction_date, debit, credit) VALUES (?, ?, ?, 1, ?, ?, 100, 0)",
                    UUID.randomUUID(), tenant.getId(), voucherId, systemAccount(tenant, SystemAccount.CASH), MARCH_1);
            });
        }

        private double unbalancedCount(String statement) {
            return meterRegistry.counter("ledger.books.unbalanced", "statement", statement).count();
        }

        @Test
        @DisplayName("Out-of-balance books raise BooksUnbalanced and count the alarm")
        void unbalancedBooksAreReported() {
            printTestHeader("Books out of balance");
            salesInvoices.post(tenant, invoice("INV-001").subtotal(10_000).build());
            writeUnbalancedVoucherAroundTheEngine();
            double trialBefore = unbalancedCount("Trial_balance");
            double sheetBefore = unbalancedCount("Balance_sheet");

            BooksUnbalancedException trial = assertThrows(BooksUnbalancedException.class,
                () -> statementService.trialBalance(tenant, MARCH_31));
            BooksUnbalancedException sheet = assertThrows(BooksUnbalancedException.class,
                () -> statementService.balanceSheet(tenant, MARCH_31));
            printExpectedException("BooksUnbalancedException", trial.getMessage());

            assertEquals("BOOKS_UNBALANCED", trial.getErrorCode());
            assertEquals("BOOKS_UNBALANCED", sheet.getErrorCode());
            assertEquals(trialBefore + 1, unbalancedCount("Trial_balance"));
            assertEquals(sheetBefore + 1, unbalancedCount("Balance_sheet"));

            // other tenants are unaffected
            assertTrue(statementService.trialBalance(newTenant(), MARCH_31).isBalanced());
        }
    }
}
