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
 * Expense: Dr expense account, Cr paying account.
 */
@Component
public class ExpensePostingProducer extends PostingProducer<ExpenseRecord> {

    public ExpensePostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, ExpenseRecord expense) {
        String label = expense.getDescription() != null ? expense.getDescription() : "Expense " + expense.getExpenseId();
        return PostingRequest.builder()
            .origin(OriginModule.EXPENSE)
            .transactionDate(expense.getExpenseDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.EXPENSE, expense.getExpenseId()))
            .line(PostingLine.debit(expense.getExpenseAccountId(), expense.getAmount(), label))
            .line(PostingLine.credit(orSystem(tenant, expense.getPaymentAccountId(), SystemAccount.CASH),
                expense.getAmount(), label))
            .build();
    }
}
