package com.flagship.tenant_ledger.ledger.exception;

import java.util.Collection;

/**
 * Onboarding could not seed the system chart of accounts. The onboarding
 * transaction is rolled back, so no half-provisioned tenant is left behind.
 */
public class TenantProvisioningException extends LedgerException {

    public TenantProvisioningException(String identifier, Collection<?> missing) {
        super("TENANT_PROVISIONING_FAILED",
            "Tenant " + identifier + " is missing system accounts " + missing);
    }
}
