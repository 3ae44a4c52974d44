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
 * Supplier payment: Dr Accounts Payable, Cr Cash/Bank, tagged with the bill.
 */
@Component
public class SupplierPaymentPostingProducer extends PostingProducer<DocumentSettlement> {

    public SupplierPaymentPostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, DocumentSettlement payment) {
        String label = "Payment for bill " + payment.getDocumentId();
        return PostingRequest.builder()
            .origin(OriginModule.PURCHASE)
            .transactionDate(payment.getSettlementDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.PURCHASE_BILL, payment.getDocumentId()))
            .line(PostingLine.debit(system(tenant, SystemAccount.ACCOUNTS_PAYABLE), payment.getAmount(), label))
            .line(PostingLine.credit(orSystem(tenant, payment.getCashAccountId(), SystemAccount.BANK),
                payment.getAmount(), label))
            .build();
    }
}
