package com.flagship.tenant_ledger.account;

import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.exception.AccountInUseException;
import com.flagship.tenant_ledger.ledger.exception.DuplicateAccountException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.support.IntegrationTestSupport;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ChartOfAccountsServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = newTenant();
    }

    private void postAgainst(UUID accountId) {
        ledgerService.commit(tenant, PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(LocalDate.of(2024, 5, 1))
            .line(PostingLine.debit(accountId, 1_000, null))
            .line(PostingLine.credit(systemAccount(tenant, SystemAccount.OWNERS_CAPITAL), 1_000, null))
            .build());
    }

    @Test
    void createsAndListsByType() {
        Account account = chartOfAccounts.createAccount(tenant, "1110", "Zenith Current", AccountType.ASSET);

        assertTrue(account.isActive());
        assertFalse(account.isSystem());
        assertEquals(account, chartOfAccounts.requireAccount(tenant, account.getId()));
        try (Stream<Account> assets = chartOfAccounts.listAccounts(tenant, AccountType.ASSET)) {
            List<String> names = assets.map(Account::getName).collect(Collectors.toList());
            assertTrue(names.contains("Zenith Current"));
            assertTrue(names.contains("Cash"));
            assertFalse(names.contains("Sales Revenue"));
        }
    }

    @Test
    @DisplayName("Names are unique per tenant, case-insensitively")
    void duplicateNameRejected() {
        chartOfAccounts.createAccount(tenant, "Office Supplies", AccountType.EXPENSE);

        assertThrows(DuplicateAccountException.class,
            () -> chartOfAccounts.createAccount(tenant, "office supplies", AccountType.EXPENSE));
        assertThrows(DuplicateAccountException.class,
            () -> chartOfAccounts.createAccount(tenant, "1000", "Another Cash", AccountType.ASSET));

        // other tenants may reuse the name
        Tenant other = newTenant();
        assertDoesNotThrow(() -> chartOfAccounts.createAccount(other, "Office Supplies", AccountType.EXPENSE));
    }

    @Test
    @DisplayName("System accounts cannot be deactivated or retyped")
    void systemAccountsAreProtected() {
        UUID cash = systemAccount(tenant, SystemAccount.CASH);

        assertThrows(AccountInUseException.class, () -> chartOfAccounts.deactivateAccount(tenant, cash));
        assertThrows(AccountInUseException.class,
            () -> chartOfAccounts.changeAccountType(tenant, cash, AccountType.EXPENSE));
    }

    @Test
    @DisplayName("Account with unreconciled entries cannot be deactivated")
    void unreconciledEntriesBlockDeactivation() {
        Account till = chartOfAccounts.createAccount(tenant, "Shop Till", AccountType.ASSET);
        postAgainst(till.getId());

        AccountInUseException e = assertThrows(AccountInUseException.class,
            () -> chartOfAccounts.deactivateAccount(tenant, till.getId()));
        assertEquals(till.getId(), e.getAccountId());
    }

    @Test
    @DisplayName("Type can change only while no entries reference the account")
    void typeChangeBeforeFirstPosting() {
        Account account = chartOfAccounts.createAccount(tenant, "Deposits", AccountType.ASSET);

        Account retyped = chartOfAccounts.changeAccountType(tenant, account.getId(), AccountType.LIABILITY);
        assertEquals(AccountType.LIABILITY, retyped.getType());

        postAgainst(account.getId());
        assertThrows(AccountInUseException.class,
            () -> chartOfAccounts.changeAccountType(tenant, account.getId(), AccountType.ASSET));
    }

    @Test
    void deactivatedAccountStaysReadable() {
        Account unused = chartOfAccounts.createAccount(tenant, "Unused", AccountType.EXPENSE);

        Account deactivated = chartOfAccounts.deactivateAccount(tenant, unused.getId());

        assertFalse(deactivated.isActive());
        assertFalse(chartOfAccounts.requireAccount(tenant, unused.getId()).isActive());
    }

    @Test
    void otherTenantsAccountIsUnknown() {
        Tenant other = newTenant();
        UUID foreignCash = systemAccount(other, SystemAccount.CASH);

        assertTrue(chartOfAccounts.findAccount(tenant, foreignCash).isEmpty());
        assertTrue(chartOfAccounts.findAccount(other, foreignCash).isPresent());
        assertThrows(UnknownAccountException.class, () -> chartOfAccounts.requireAccount(tenant, foreignCash));
    }

    @Test
    @DisplayName("Retype waits for an in-flight posting and then sees its entries")
    void retypeWaitsForInFlightPosting() throws Exception {
        printTestHeader("Retype racing a posting");
        Account deposits = chartOfAccounts.createAccount(tenant, "Customer Deposits", AccountType.LIABILITY);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CountDownLatch posted = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            // the posting holds the tenant lock with its entries written but not yet committed
            Future<?> posting = executor.submit(() -> transaction.executeWithoutResult(status -> {
                postAgainst(deposits.getId());
                posted.countDown();
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(posted.await(30, TimeUnit.SECONDS));

            assertThrows(AccountInUseException.class,
                () -> chartOfAccounts.changeAccountType(tenant, deposits.getId(), AccountType.ASSET));
            posting.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(AccountType.LIABILITY, chartOfAccounts.requireAccount(tenant, deposits.getId()).getType());
        printSuccess("Type unchanged; the posting's entries were seen");
    }

    @Test
    @DisplayName("Deactivation waits for an in-flight posting and then sees its entries")
    void deactivationWaitsForInFlightPosting() throws Exception {
        Account till = chartOfAccounts.createAccount(tenant, "Second Till", AccountType.ASSET);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CountDownLatch posted = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> posting = executor.submit(() -> transaction.executeWithoutResult(status -> {
                postAgainst(till.getId());
                posted.countDown();
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(posted.await(30, TimeUnit.SECONDS));

            assertThrows(AccountInUseException.class, () -> chartOfAccounts.deactivateAccount(tenant, till.getId()));
            posting.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertTrue(chartOfAccounts.requireAccount(tenant, till.getId()).isActive());
    }
}
