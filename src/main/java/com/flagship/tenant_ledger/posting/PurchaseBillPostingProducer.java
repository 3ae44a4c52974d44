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

/**
 * Purchase bill: Dr Inventory (or the given expense account) net,
 * Dr VAT Refundable tax, Cr Accounts Payable total.
 *
 * The bill is registered with the document store in the same transaction as
 * its voucher. A bill id can be posted once.
 */
@Component
public class PurchaseBillPostingProducer extends PostingProducer<PurchaseBill> {

    private final SourceDocumentStore documentStore;
    private final TenantLock tenantLock;

    public PurchaseBillPostingProducer(LedgerService ledgerService, ChartOfAccountsService chartOfAccounts,
                                       SourceDocumentStore documentStore, TenantLock tenantLock) {
        super(ledgerService, chartOfAccounts);
        this.documentStore = documentStore;
        this.tenantLock = tenantLock;
    }

    @Override
    public PostingRequest toPostingRequest(Tenant tenant, PurchaseBill bill) {
        long net = VatCalculator.netAmount(bill.getSubtotal(), bill.getDiscount());
        long vat = VatCalculator.vat(net, bill.getVatRatePercent());
        long total = Math.addExact(net, vat);
        String label = "Bill " + bill.getBillId();

        PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
            .origin(OriginModule.PURCHASE)
            .transactionDate(bill.getBillDate())
            .note(bill.getSupplier() != null ? label + " - " + bill.getSupplier() : label)
            .sourceDocument(SourceDocumentRef.of(SourceDocumentType.PURCHASE_BILL, bill.getBillId()))
            .line(PostingLine.debit(orSystem(tenant, bill.getDebitAccountId(), SystemAccount.INVENTORY),
                net, "Purchases - " + label));
        if (vat > 0) {
            request.line(PostingLine.debit(system(tenant, SystemAccount.VAT_REFUNDABLE), vat, "Input VAT - " + label));
        }
        request.line(PostingLine.credit(system(tenant, SystemAccount.ACCOUNTS_PAYABLE), total, label));
        return request.build();
    }

    @Override
    @Transactional
    public JournalVoucher post(Tenant tenant, PurchaseBill bill) {
        PostingRequest request = toPostingRequest(tenant, bill);
        long total = request.getLines().get(request.getLines().size() - 1).getCredit();
        tenantLock.acquire(tenant.getId());
        if (documentStore.find(tenant.getId(), SourceDocumentType.PURCHASE_BILL, bill.getBillId()).isPresent()) {
            throw new DuplicateDocumentException(SourceDocumentType.PURCHASE_BILL, bill.getBillId());
        }

        JournalVoucher voucher = ledgerService.commit(tenant, request);
        documentStore.register(SourceDocument.builder()
            .tenantId(tenant.getId())
            .type(SourceDocumentType.PURCHASE_BILL)
            .documentId(bill.getBillId())
            .counterparty(bill.getSupplier())
            .documentDate(bill.getBillDate())
            .dueDate(bill.getDueDate() != null ? bill.getDueDate() : bill.getBillDate())
            .total(total)
            .build());
        return voucher;
    }
}
