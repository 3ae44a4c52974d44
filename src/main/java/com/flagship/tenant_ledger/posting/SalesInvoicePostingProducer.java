package com.flagship.tenant_ledger.posting;

import com.flagship.tenant_ledger.account.ChartOfAccountsService;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.document.SourceDocument;
import com.flagship.tenant_ledger.document.SourceDocumentStore;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.ledger.SourceDocumentType;
import com.flagship.tenant_ledger.ledger.TenantLock;
import com.flagship.tenant_ledger.ledger.exception.DuplicateDocumentException;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Sales invoice:
 * Dr Accounts Receivable (or the deposit account for cash sales) total,
 * Cr Sales Revenue net, Cr VAT Payable tax,
 * plus Dr Cost of Goods Sold / Cr Inventory when a cost basis is given.
 *
 * Credit invoices are registered with the document store so aging can see them.
 * The voucher and the registration commit together; an invoice id that is
 * already registered is rejected before anything is posted.
 */
@Component
public class SalesInvoicePostingProducer extends PostingProducer<SalesInvoice> {

    private final SourceDocumentStore documentStore;
    private final TenantLock tenantLock;

    public SalesInvoicePostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts,
                                       SourceDocumentStore documentStore, TenantLock tenantLock) {
        super(ledgerService, chartOfAccounts);
        this.documentStore = documentStore;
        this.tenantLock = tenantLock;
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, SalesInvoice invoice) {
        long net = VatCalculator.netAmount(invoice.getSubtotal(), invoice.getDiscount());
        long vat = VatCalculator.vat(net, invoice.getVatRatePercent());
        long total = Math.addExact(net, vat);

        UUID receivingAccount = invoice.isCashSale()
            ? orSystem(tenant, invoice.getDepositAccountId(), SystemAccount.CASH)
            : system(tenant, SystemAccount.ACCOUNTS_RECEIVABLE);
        String label = "Invoice " + invoice.getInvoiceId();

        PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
            .origin(OriginModule.SALES)
            .transactionDate(invoice.getInvoiceDate())
            .note(invoice.getCustomer() != null ? label + " - " + invoice.getCustomer() : label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.SALES_INVOICE, invoice.getInvoiceId()))
            .line(PostingLine.debit(receivingAccount, total, label))
            .line(PostingLine.credit(orSystem(tenant, invoice.getRevenueAccountId(), SystemAccount.SALES_REVENUE),
                net, "Sales - " + label));
        if (vat > 0) {
            request.line(PostingLine.credit(system(tenant, SystemAccount.VAT_PAYABLE), vat, "Output VAT - " + label));
        }
        if (invoice.getCostOfGoods() != 0) {
            request.line(PostingLine.debit(system(tenant, SystemAccount.COST_OF_GOODS_SOLD),
                invoice.getCostOfGoods(), "Cost of sales - " + label));
            request.line(PostingLine.credit(system(tenant, SystemAccount.INVENTORY),
                invoice.getCostOfGoods(), "Inventory issued - " + label));
        }
        return request.build();
    }

    @Override
    @Transactional
    public JournalVoucher post(Tenant tenant, SalesInvoice invoice) {
        PostingRequest request = toPostingRequest(tenant, invoice);
        if (invoice.isCashSale()) {
            return ledgerService.commit(tenant, request);
        }
        // held until the registration commits, so the duplicate check cannot race
        tenantLock.acquire(tenant.getId());
        if (documentStore.find(tenant.getId(), SourceDocumentType.SALES_INVOICE, invoice.getInvoiceId()).isPresent()) {
            throw new DuplicateDocumentException(SourceDocumentType.SALES_INVOICE, invoice.getInvoiceId());
        }

        JournalVoucher voucher = ledgerService.commit(tenant, request);
        documentStore.register(SourceDocument.builder()
            .tenantId(tenant.getId())
            .type(SourceDocumentType.SALES_INVOICE)
            .documentId(invoice.getInvoiceId())
            .counterparty(invoice.getCustomer())
            .documentDate(invoice.getInvoiceDate())
            .dueDate(invoice.getDueDate() != null ? invoice.getDueDate() : invoice.getInvoiceDate())
            .total(request.getLines().get(0).getDebit())
            .build());
        return voucher;
    }
}
