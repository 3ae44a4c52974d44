package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.ledger.exception.InvalidTransferException;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.springframework.stereotype.Component;

/**
 * Fund transfer: Dr destination, Cr source.
 */
@Component
public class FundTransferPostingProducer extends PostingProducer<FundTransfer> {

    public FundTransferPostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, FundTransfer transfer) {
        if (transfer.getSourceAccountId().equals(transfer.getDestinationAccountId())) {
            throw new InvalidTransferException(transfer.getSourceAccountId());
        }
        String label = transfer.getNote() != null ? transfer.getNote() : "Transfer " + transfer.getTransferId();
        return PostingRequest.builder()
            .origin(OriginModule.FUND_TRANSFER)
            .transactionDate(transfer.getTransferDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.FUND_TRANSFER, transfer.getTransferId()))
            .line(PostingLine.debit(transfer.getDestinationAccountId(), transfer.getAmount(), label))
            .line(PostingLine.credit(transfer.getSourceAccountId(), transfer.getAmount(), label))
            .build();
    }
}
