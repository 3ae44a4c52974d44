package com.flagship.tenant_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.JournalVoucher;
import com.flagship.tenant_ledger.ledger.LedgerService;
import com.flagship.tenant_ledger.ledger.OriginModule;
import com.flagship.tenant_ledger.ledger.PostingLine;
import com.flagship.tenant_ledger.ledger.PostingRequest;
import com.flagship.tenant_ledger.ledger.event.VoucherPostedEvent;
import com.flagship.tenant_ledger.ledger.exception.UnbalancedPostingException;
import com.flagship.tenant_ledger.support.IntegrationTestSupport;
import com.flagship.tenant_ledger.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox guarantees: a committed voucher always has exactly one VoucherPosted
 * event, a rejected posting has none, and the publisher bookkeeping moves
 * events out of the unpublished set.
 */
class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Tenant tenant;
    private UUID cash;
    private UUID capital;

    @BeforeEach
    void setUp() {
        tenant = newTenant();
        cash = systemAccount(tenant, SystemAccount.CASH);
        capital = systemAccount(tenant, SystemAccount.OWNERS_CAPITAL);
    }

    private PostingRequest funding(long debit, long credit) {
        return PostingRequest.builder()
            .origin(OriginModule.MANUAL)
            .transactionDate(LocalDate.of(2024, 5, 2))
            .note("Owner funding")
            .line(PostingLine.debit(cash, debit, null))
            .line(PostingLine.credit(capital, credit, null))
            .build();
    }

    @Test
    @DisplayName("Committed voucher writes one VoucherPosted event in the same transaction")
    void commitWritesEvent() throws Exception {
        printTestHeader("Outbox event on commit");

        JournalVoucher voucher = ledgerService.commit(tenant, funding(500_000, 500_000));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, voucher.getId());
        assertEquals(1, events.size());

        OutboxEvent event = events.get(0);
        printOutput("Event", event);
        assertEquals(VoucherPostedEvent.EVENT_TYPE, event.getEventType());
        assertFalse(event.isPublished());
        assertNotNull(event.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(voucher.getVoucherNumber(), payload.get("voucherNumber").asText());
        assertEquals(500_000L, payload.get("totalAmount").asLong());
        assertEquals(2, payload.get("lineCount").asInt());
        assertEquals("MANUAL", payload.get("origin").asText());
        assertEquals("2024-05-02", payload.get("transactionDate").asText());
        printSuccess("Event payload describes the voucher");
    }

    @Test
    @DisplayName("Rejected posting leaves no event behind")
    void rejectedPostingWritesNothing() {
        long before = eventCount(tenant.getId());

        assertThrows(UnbalancedPostingException.class,
            () -> ledgerService.commit(tenant, funding(10_000, 9_000)));

        assertEquals(before, eventCount(tenant.getId()));
    }

    @Test
    void markPublishedRemovesEventFromBacklog() {
        JournalVoucher voucher = ledgerService.commit(tenant, funding(1_000, 1_000));
        OutboxEvent event = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, voucher.getId()).get(0);
        long backlog = outboxService.countUnpublished();

        outboxService.markPublished(event.getId());

        OutboxEvent published = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, voucher.getId()).get(0);
        assertTrue(published.isPublished());
        assertEquals(backlog - 1, outboxService.countUnpublished());
    }

    @Test
    void markFailedRecordsRetry() {
        JournalVoucher voucher = ledgerService.commit(tenant, funding(2_000, 2_000));
        UUID eventId = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, voucher.getId()).get(0).getId();

        outboxService.markFailed(eventId, "broker unavailable");
        outboxService.markFailed(eventId, "broker still unavailable");

        OutboxEvent failed = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, voucher.getId()).get(0);
        assertFalse(failed.isPublished());
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker still unavailable", failed.getLastError());
    }

    @Test
    void eventsAreOrderedBySequence() {
        JournalVoucher first = ledgerService.commit(tenant, funding(100, 100));
        JournalVoucher second = ledgerService.commit(tenant, funding(200, 200));

        long firstSequence = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, first.getId()).get(0).getSequenceNumber();
        long secondSequence = outboxService.getEventsForAggregate(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, second.getId()).get(0).getSequenceNumber();
        assertTrue(secondSequence > firstSequence);
    }

    @Test
    @DisplayName("saveEvent refuses to run outside a transaction")
    void saveEventRequiresTransaction() {
        printExpectedException("IllegalTransactionStateException", "MANDATORY propagation");
        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(
            tenant.getId(), VoucherPostedEvent.AGGREGATE_TYPE, UUID.randomUUID(),
            VoucherPostedEvent.EVENT_TYPE, Map.of("voucherNumber", "JV-2024-000001")));
    }

    private long eventCount(UUID tenantId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE tenant_id = ?", Long.class, tenantId);
        return count != null ? count : 0L;
    }
}
