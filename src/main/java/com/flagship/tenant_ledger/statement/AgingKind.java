package com.flagship.tenant_ledger.statement;

import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;

public enum AgingKind {
    RECEIVABLES(SystemAccount.ACCOUNTS_RECEIVABLE, SourceDocumentType.SALES_INVOICE),
    PAYABLES(SystemAccount.ACCOUNTS_PAYABLE, SourceDocumentType.PURCHASE_BILL);

    private final SystemAccount controlAccount;
    private final SourceDocumentType documentType;

    AgingKind(SystemAccount controlAccount, SourceDocumentType documentType) {
        this.controlAccount = controlAccount;
        this.documentType = documentType;
    }

    public SystemAccount getControlAccount() {
        return controlAccount;
    }

    public SourceDocumentType getDocumentType() {
        return documentType;
    }

    /**
     * Converts a net debit on the control account into an open amount owed.
     */
    long openAmount(long netDebit) {
        return this == RECEIVABLES ? netDebit : -netDebit;
    }
}
