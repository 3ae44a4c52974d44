package com.flagship.tenant_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the tenant ledger service.
 *
 * Retry advice is ordered ahead of the transaction advice (the {@link EnableRetry}
 * default), so every retried posting attempt runs in a fresh transaction.
 */
@SpringBootApplication
@EnableRetry
@EnableScheduling
public class TenantLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantLedgerApplication.class, args);
    }
}
