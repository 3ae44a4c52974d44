package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.Money;
import com.flagship.tenant_ledger.statement.AccountLedger;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AccountLedgerResponse {

    @JsonProperty("account")
    AccountResponse account;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    public static AccountLedgerResponse from(AccountLedger ledger) {
        return AccountLedgerResponse.builder()
            .account(AccountResponse.from(ledger.getAccount()))
            .from(ledger.getFrom())
            .to(ledger.getTo())
            .openingBalance(Money.toDecimal(ledger.getOpeningBalance()))
            .lines(ledger.getLines().stream()
                .map(line -> new Line(line.getEntryId(), line.getVoucherNumber(), line.getTransactionDate(),
                    line.getDescription(), Money.toDecimal(line.getDebit()), Money.toDecimal(line.getCredit()),
                    line.isReconciled(), Money.toDecimal(line.getRunningBalance())))
                .toList())
            .closingBalance(Money.toDecimal(ledger.getClosingBalance()))
            .build();
    }

    @Value
    public static class Line {
        @JsonProperty("entry_id")
        UUID entryId;
        @JsonProperty("voucher_number")
        String voucherNumber;
        @JsonProperty("transaction_date")
        LocalDate transactionDate;
        @JsonProperty("description")
        String description;
        @JsonProperty("debit")
        BigDecimal debit;
        @JsonProperty("credit")
        BigDecimal credit;
        @JsonProperty("reconciled")
        boolean reconciled;
        @JsonProperty("running_balance")
        BigDecimal runningBalance;
    }
}
