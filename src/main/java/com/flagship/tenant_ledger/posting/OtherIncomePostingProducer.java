package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.springframework.stereotype.Component;

/**
 * Other income: Dr deposit account, Cr income account.
 */
@Component
public class OtherIncomePostingProducer extends PostingProducer<OtherIncomeReceipt> {

    public OtherIncomePostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, OtherIncomeReceipt income) {
        String label = income.getDescription() != null ? income.getDescription() : "Income " + income.getIncomeId();
        return PostingRequest.builder()
            .origin(OriginModule.OTHER_INCOME)
            .transactionDate(income.getReceivedDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.INCOME, income.getIncomeId()))
            .line(PostingLine.debit(orSystem(tenant, income.getDepositAccountId(), SystemAccount.CASH),
                income.getAmount(), label))
            .line(PostingLine.credit(orSystem(tenant, income.getIncomeAccountId(), SystemAccount.OTHER_INCOME),
                income.getAmount(), label))
            .build();
    }
}
