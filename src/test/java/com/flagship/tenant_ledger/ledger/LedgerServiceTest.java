package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.exception.TenantSuspendedException;
import com.flagship.tenant_ledger.ledger.exception.UnbalancedPostingException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.ledger.exception.VoucherNotFoundException;
import com.flagship.tenant_ledger.statement.StatementService;
import com.flagship.tenant_ledger.support.IntegrationTestSupport;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Posting engine tests against a real PostgreSQL.
 *
 * Verifies:
 * - Balanced postings commit with every line
 * - Rejected postings write nothing
 * - Concurrent postings against one account never lose an update
 * - Voucher numbers increase and are never reused
 * - A tenant can never post to another tenant's accounts
 */
class LedgerServiceTest extends IntegrationTestSupport {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private StatementService statementService;

    @Autowired
    private VoucherNumberAllocator numberAllocator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Tenant tenant;
    private UUID cash;
    private UUID capital;

    @BeforeEach
    void setUp() {
        tenant = newTenant();
        cash = systemAccount(tenant, SystemAccount.CASH);
        capital = systemAccount(tenant, SystemAccount.OWNERS_CAPITAL);
    }

    private PostingRequest capitalInjection(long amount) {
        return PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(TODAY)
            .note("Capital injection")
            .line(PostingLine.debit(cash, amount, "Cash in"))
            .line(PostingLine.credit(capital, amount, "Owner's capital"))
            .build();
    }

    private int countVouchers(Tenant t) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_vouchers WHERE tenant_id = ?", Integer.class, t.getId());
    }

    private int countEntries(Tenant t) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE tenant_id = ?", Integer.class, t.getId());
    }

    @Nested
    @DisplayName("Commit")
    class Commit {

        @Test
        @DisplayName("Balanced posting is written as one numbered voucher")
        void balancedPostingCommits() {
            printTestHeader("Balanced posting commits");
            printInput("Tenant", tenant.getIdentifier());

            JournalVoucher voucher = ledgerService.commit(tenant, capitalInjection(500_000));

            printOutput("Voucher", voucher.getVoucherNumber());
            assertNotNull(voucher.getId());
            assertEquals(tenant.getId(), voucher.getTenantId());
            assertTrue(voucher.getVoucherNumber().startsWith("JV-2024-"));
            assertEquals(2, voucher.getEntries().size());
            assertEquals(500_000, voucher.getTotalDebit());
            assertEquals(500_000, voucher.getTotalCredit());

            JournalVoucher loaded = ledgerService.findVoucher(tenant, voucher.getVoucherNumber());
            assertEquals(voucher.getId(), loaded.getId());
            assertEquals(2, loaded.getEntries().size());
            assertEquals(1, loaded.getEntries().get(0).getLineNumber());
            assertEquals(cash, loaded.getEntries().get(0).getAccountId());
            assertEquals(500_000, statementService.accountBalance(tenant, cash, TODAY));
            printSuccess("Voucher committed with both lines");
        }

        @Test
        @DisplayName("Debit 100 against credit 90 writes nothing")
        void unbalancedPostingWritesNothing() {
            printTestHeader("Unbalanced posting is rejected");
            PostingRequest request = PostingRequest.builder()
                .origin(OriginModule.MANUAL)
                .transactionDate(TODAY)
                .line(PostingLine.debit(cash, 100, null))
                .line(PostingLine.credit(capital, 90, null))
                .build();

            UnbalancedPostingException e = assertThrows(UnbalancedPostingException.class,
                () -> ledgerService.commit(tenant, request));

            printExpectedException("UnbalancedPostingException", e.getMessage());
            assertEquals(100, e.getTotalDebit());
            assertEquals(90, e.getTotalCredit());
            assertEquals(0, countVouchers(tenant));
            assertEquals(0, countEntries(tenant));
        }

        @Test
        @DisplayName("Deactivated account is rejected as unknown")
        void deactivatedAccountRejected() {
            Account petty = chartOfAccounts.createAccount(tenant, "Petty Cash", AccountType.ASSET);
            chartOfAccounts.deactivateAccount(tenant, petty.getId());

            PostingRequest request = PostingRequest.builder()
                .origin(OriginModule.MANUAL)
                .transactionDate(TODAY)
                .line(PostingLine.debit(petty.getId(), 1_000, null))
                .line(PostingLine.credit(capital, 1_000, null))
                .build();

            assertThrows(UnknownAccountException.class, () -> ledgerService.commit(tenant, request));
            assertEquals(0, countVouchers(tenant));
        }

        @Test
        @DisplayName("Suspended tenant cannot post")
        void suspendedTenantRejected() {
            Tenant suspended = onboardingService.suspend(tenant.getIdentifier());

            assertThrows(TenantSuspendedException.class,
                () -> ledgerService.commit(suspended, capitalInjection(1_000)));
            assertEquals(0, countVouchers(tenant));
        }

        @Test
        @DisplayName("Same idempotency key returns the first voucher")
        void idempotencyKeyReturnsExistingVoucher() {
            printTestHeader("Idempotent commit");
            PostingRequest request = capitalInjection(25_000).toBuilder().idempotencyKey("import-42").build();

            JournalVoucher first = ledgerService.commit(tenant, request);
            JournalVoucher second = ledgerService.commit(tenant, request);

            printOutput("First", first.getVoucherNumber());
            printOutput("Second", second.getVoucherNumber());
            assertEquals(first.getId(), second.getId());
            assertEquals(1, countVouchers(tenant));
            assertEquals(25_000, statementService.accountBalance(tenant, cash, TODAY));
        }

        @Test
        void unknownVoucherNumber() {
            assertThrows(VoucherNotFoundException.class,
                () -> ledgerService.findVoucher(tenant, "JV-2024-999999"));
        }

        @Test
        @DisplayName("Vouchers are listed by transaction date range")
        void listsVouchersByDate() {
            ledgerService.commit(tenant, capitalInjection(1_000));
            ledgerService.commit(tenant, capitalInjection(2_000).toBuilder()
                .transactionDate(TODAY.plusMonths(1)).build());

            List<JournalVoucher> march = ledgerService.listVouchers(tenant, TODAY.withDayOfMonth(1), TODAY.withDayOfMonth(31));

            assertEquals(1, march.size());
            assertEquals(1_000, march.get(0).getTotalDebit());
        }
    }

    @Nested
    @DisplayName("Voucher numbering")
    class Numbering {

        @Test
        @DisplayName("Sequence numbers strictly increase per tenant")
        void strictlyIncreasing() {
            long previous = 0;
            for (int i = 0; i < 5; i++) {
                JournalVoucher voucher = ledgerService.commit(tenant, capitalInjection(100 + i));
                assertTrue(voucher.getSequenceNumber() > previous);
                assertEquals(voucher.getSequenceNumber(), VoucherNumbers.sequenceOf(voucher.getVoucherNumber()));
                previous = voucher.getSequenceNumber();
            }
        }

        @Test
        @DisplayName("A number taken by a crashed posting is skipped, never reused")
        void allocatedNumberNeverReused() {
            printTestHeader("Crash between allocation and write");
            JournalVoucher before = ledgerService.commit(tenant, capitalInjection(100));

            // a posting that allocated its number and then died
            long lost = numberAllocator.next(tenant.getId());

            JournalVoucher after = ledgerService.commit(tenant, capitalInjection(200));

            printOutput("Before", before.getSequenceNumber());
            printOutput("Lost", lost);
            printOutput("After", after.getSequenceNumber());
            assertEquals(before.getSequenceNumber() + 1, lost);
            assertEquals(lost + 1, after.getSequenceNumber());
            assertEquals(2, countVouchers(tenant));
        }

        @Test
        @DisplayName("Each tenant has its own sequence")
        void sequencePerTenant() {
            Tenant other = newTenant();
            UUID otherCash = systemAccount(other, SystemAccount.CASH);
            UUID otherCapital = systemAccount(other, SystemAccount.OWNERS_CAPITAL);

            ledgerService.commit(tenant, capitalInjection(100));
            ledgerService.commit(tenant, capitalInjection(100));
            JournalVoucher first = ledgerService.commit(other, PostingRequest.builder()
                .origin(OriginModule.MANUAL)
                .transactionDate(TODAY)
                .line(PostingLine.debit(otherCash, 100, null))
                .line(PostingLine.credit(otherCapital, 100, null))
                .build());

            assertEquals(1, first.getSequenceNumber());
            assertEquals("JV-2024-000001", first.getVoucherNumber());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent 50 and 30 on the same Cash account total 80")
        void concurrentPostingsBothLand() throws Exception {
            printTestHeader("Concurrent postings on one account");
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<JournalVoucher> fifty = executor.submit(() -> {
                    start.await();
                    return ledgerService.commit(tenant, capitalInjection(50));
                });
                Future<JournalVoucher> thirty = executor.submit(() -> {
                    start.await();
                    return ledgerService.commit(tenant, capitalInjection(30));
                });
                start.countDown();

                JournalVoucher a = fifty.get(30, TimeUnit.SECONDS);
                JournalVoucher b = thirty.get(30, TimeUnit.SECONDS);

                assertNotEquals(a.getVoucherNumber(), b.getVoucherNumber());
            } finally {
                executor.shutdownNow();
            }

            long balance = statementService.accountBalance(tenant, cash, TODAY);
            printOutput("Cash balance", balance);
            assertEquals(80, balance);
        }

        @Test
        @DisplayName("Many concurrent postings keep distinct numbers and a correct total")
        void manyConcurrentPostings() throws Exception {
            int threads = 10;
            int perThread = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<String>>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        List<String> numbers = new ArrayList<>();
                        for (int i = 0; i < perThread; i++) {
                            numbers.add(ledgerService.commit(tenant, capitalInjection(10)).getVoucherNumber());
                        }
                        return numbers;
                    }));
                }
                start.countDown();

                Set<String> numbers = new HashSet<>();
                for (Future<List<String>> future : futures) {
                    numbers.addAll(future.get(60, TimeUnit.SECONDS));
                }
                assertEquals(threads * perThread, numbers.size());
            } finally {
                executor.shutdownNow();
            }

            assertEquals(threads * perThread * 10L, statementService.accountBalance(tenant, cash, TODAY));
            assertTrue(statementService.trialBalance(tenant, TODAY).isBalanced());
        }
    }

    @Nested
    @DisplayName("Tenant isolation")
    class Isolation {

        @Test
        @DisplayName("Another tenant's account id is unknown to this tenant")
        void foreignAccountRejected() {
            printTestHeader("Cross-tenant posting");
            Tenant other = newTenant();
            UUID foreignCash = systemAccount(other, SystemAccount.CASH);
            printInput("Foreign account", foreignCash);

            PostingRequest request = PostingRequest.builder()
                .origin(OriginModule.MANUAL)
                .transactionDate(TODAY)
                .line(PostingLine.debit(foreignCash, 1_000, null))
                .line(PostingLine.credit(capital, 1_000, null))
                .build();

            UnknownAccountException e = assertThrows(UnknownAccountException.class,
                () -> ledgerService.commit(tenant, request));
            printExpectedException("UnknownAccountException", e.getMessage());
            assertEquals(foreignCash, e.getAccountId());
            assertEquals(0, countEntries(tenant));
            assertEquals(0, countEntries(other));
        }

        @Test
        @DisplayName("Reads never cross tenants")
        void readsAreScoped() {
            Tenant other = newTenant();
            JournalVoucher voucher = ledgerService.commit(tenant, capitalInjection(7_000));

            assertThrows(UnknownAccountException.class,
                () -> statementService.accountBalance(other, cash, TODAY));
            assertThrows(VoucherNotFoundException.class,
                () -> ledgerService.findVoucher(other, voucher.getVoucherNumber()));
            assertTrue(statementService.trialBalance(other, TODAY).getLines().stream()
                .allMatch(line -> line.getDebit() == 0 && line.getCredit() == 0));
        }
    }

    @Nested
    @DisplayName("Storage safeguards")
    class StorageSafeguards {

        @Test
        @DisplayName("Database refuses an unbalanced voucher written around the engine")
        void deferredTriggerRejectsUnbalancedVoucher() {
            UUID voucherId = UUID.randomUUID();

            TransactionTemplate tx = new TransactionTemplate(transactionManager);

            assertThrows(RuntimeException.class, () -> tx.executeWithoutResult(status -> {
                jdbcTemplate.update("INSERT INTO journal_vouchers (id, tenant_id, voucher_number, sequence_number, " +
                        "transaction_date, origin) VALUES (?, ?, 'JV-2024-900000', 900000, ?, 'MANUAL')",
                    voucherId, tenant.getId(), TODAY);
                jdbcTemplate.update("INSERT INTO ledger_entries (id, tenant_id, voucher_id, line_number, account_id, " +
                        "transaction_date, debit, credit) VALUES (?, ?, ?, 1, ?, ?, 100, 0)",
                    UUID.randomUUID(), tenant.getId(), voucherId, cash, TODAY);
            }));

            assertEquals(0, countVouchers(tenant));
        }
    }
}
