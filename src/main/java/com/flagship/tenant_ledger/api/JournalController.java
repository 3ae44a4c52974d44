package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.api.dto.PostJournalRequest;
import com.flagship.tenant_ledger.api.dto.VoucherResponse;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.SourceDocumentRef;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.Tenant;
import com.flagship.tenant_ledger.tenant.TenantResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Manual journal entries and voucher lookup.
 *
 * Posting accepts an optional Idempotency-Key header: a retry with the same
 * key returns the original voucher (200) instead of posting again (201).
 */
@RestController
@RequestMapping("/api/journal-vouchers")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TenantResolver tenantResolver;
    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics ledgerMetrics;

    @PostMapping
    public ResponseEntity<VoucherResponse> post(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody PostJournalRequest request) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);

        if (idempotencyKey != null) {
            Optional<JournalVoucher> existing = idempotencyService.findExisting(tenant, idempotencyKey);
            if (existing.isPresent()) {
                ledgerMetrics.recordIdempotencyHit();
                log.info("Idempotency key {} already used, returning voucher {}",
                    idempotencyKey, existing.get().getVoucherNumber());
                return ResponseEntity.ok(VoucherResponse.from(existing.get()));
            }
            ledgerMetrics.recordIdempotencyMiss();
        }

        PostingRequest.PostingRequestBuilder posting = PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(request.getTransactionDate())
            .note(request.getNote())
            .idempotencyKey(idempotencyKey);
        if (request.getSourceType() != null || request.getSourceId() != null) {
            if (request.getSourceType() == null || request.getSourceId() == null) {
                throw new IllegalArgumentException("source_type and source_id must be given together");
            }
            posting.sourceDocument(SourceDocumentRef.of(request.getSourceType(), request.getSourceId()));
        }
        for (PostJournalRequest.Line line : request.getLines()) {
            posting.line(new PostingLine(line.getAccountId(), minorUnits(line.getDebit()),
                minorUnits(line.getCredit()), line.getDescription()));
        }

        JournalVoucher voucher = ledgerService.commit(tenant, posting.build());
        if (idempotencyKey != null) {
            idempotencyService.remember(tenant, idempotencyKey, voucher);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(voucher));
    }

    @GetMapping("/{number}")
    public VoucherResponse get(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @PathVariable("number") String number) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return VoucherResponse.from(ledgerService.findVoucher(tenant, number));
    }

    @GetMapping
    public List<VoucherResponse> list(
            @RequestHeader(CorrelationContext.TENANT_ID_HEADER) String tenantId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Tenant tenant = tenantResolver.resolveTenant(tenantId);
        return ledgerService.listVouchers(tenant, from, to).stream()
            .map(VoucherResponse::from)
            .toList();
    }

    private static long minorUnits(BigDecimal amount) {
        return amount == null ? 0L : Money.toMinorUnits(amount);
    }
}
