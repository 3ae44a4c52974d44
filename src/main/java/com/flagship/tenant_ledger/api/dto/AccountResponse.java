package com.flagship.tenant_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.account.Account;
import com.flagship.tenant_ledger.account.AccountType;
import com.flagship.tenant_ledger.account.SystemAccount;
import com.flagship.tenant_ledger.ledger.EntryType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("normal_balance")
    EntryType normalBalance;

    @JsonProperty("system_role")
    SystemAccount systemRole;

    @JsonProperty("active")
    boolean active;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .type(account.getType())
            .normalBalance(account.getType().getNormalBalance())
            .systemRole(account.getSystemRole())
            .active(account.isActive())
            .build();
    }
}
