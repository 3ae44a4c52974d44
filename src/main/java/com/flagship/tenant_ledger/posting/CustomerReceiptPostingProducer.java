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
 * Customer receipt: Dr Cash/Bank, Cr Accounts Receivable, tagged with the
 * settled invoice so the receivables aging sees the reduced balance.
 */
@Component
public class CustomerReceiptPostingProducer extends PostingProducer<DocumentSettlement> {

    public CustomerReceiptPostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, DocumentSettlement receipt) {
        String label = "Receipt for invoice " + receipt.getDocumentId();
        return PostingRequest.builder()
            .origin(OriginModule.SALES)
            .transactionDate(receipt.getSettlementDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.SALES_INVOICE, receipt.getDocumentId()))
            .line(PostingLine.debit(orSystem(tenant, receipt.getCashAccountId(), SystemAccount.BANK),
                receipt.getAmount(), label))
            .line(PostingLine.credit(system(tenant, SystemAccount.ACCOUNTS_RECEIVABLE), receipt.getAmount(), label))
            .build();
    }
}
