package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.springframework.stereotype.Component;

/**
 * Payroll run: Dr Salaries & Wages gross; Cr PAYE Payable, Cr Pension Payable,
 * Cr paying account net. Zero deductions produce no line.
 */
@Component
public class PayrollPostingProducer extends PostingProducer<PayrollRun> {

    public PayrollPostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts) {
        super(ledgerService, chartOfAccounts);
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, PayrollRun run) {
        if (run.getPayeTax() < 0 || run.getPensionContribution() < 0 || run.getNetPay() < 0) {
            throw new InvalidAmountException("Payroll deductions exceed gross pay for run " + run.getRunId());
        }
        String label = "Payroll " + run.getRunId();

        PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
            .origin(OriginModule.PAYROLL)
            .transactionDate(run.getPayDate())
            .note(label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.PAYROLL_RUN, run.getRunId()))
            .line(PostingLine.debit(system(tenant, SystemAccount.SALARIES_AND_WAGES), run.getGrossPay(),
                "Gross pay - " + label));
        if (run.getPayeTax() > 0) {
            request.line(PostingLine.credit(system(tenant, SystemAccount.PAYE_PAYABLE), run.getPayeTax(),
                "PAYE - " + label));
        }
        if (run.getPensionContribution() > 0) {
            request.line(PostingLine.credit(system(tenant, SystemAccount.PENSION_PAYABLE),
                run.getPensionContribution(), "Pension - " + label));
        }
        if (run.getNetPay() > 0) {
            request.line(PostingLine.credit(orSystem(tenant, run.getPayingAccountId(), SystemAccount.BANK),
                run.getNetPay(), "Net pay - " + label));
        }
        return request.build();
    }
}
