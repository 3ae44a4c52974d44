package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.tenant.Tenant;

import java.util.UUID;

/**
 * Base for strategies that turn one kind of business event into ledger lines.
 *
 * A producer only decides which lines to submit. Validation, numbering,
 * locking and persistence all belong to {@link LedgerService#commit}.
 *
 * @param <E> the business event this producer understands
 */
public abstract class PostingProducer<E> {

    protected final LedgerService ledgerService;
    protected final ChartOfAccountsService chartOfAccounts;

    protected PostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        this.ledgerService = ledgerService;
        this.chartOfAccounts = chartOfAccounts;
    }

    /**
     * Builds the posting request for an event without committing it.
     */
    public abstract PostingRequest toPostingRequest(Tenant tenant, E event);

    public JournalVoucher post(Tenant tenant, E event) {
        return ledgerService.commit(tenant, toPostingRequest(tenant, event));
    }

    protected UUID system(Tenant tenant, SystemAccount role) {
        return chartOfAccounts.requireSystemAccount(tenant, role).getId();
    }

    protected UUID orSystem(Tenant tenant, UUID accountId, SystemAccount fallback) {
        return accountId != null ? accountId : system(tenant, fallback);
    }
}
