package com.flagship.tenant_ledger.ledger.exception;

public class UnbalancedPostingException extends PostingRejectedException {

    private final long totalDebit;
    private final long totalCredit;

    public UnbalancedPostingException(long totalDebit, long totalCredit) {
        super("UNBALANCED_POSTING",
            String.format("Posting is not balanced: debits=%d, credits=%d", totalDebit, totalCredit));
        this.totalDebit = totalDebit;
        this.totalCredit = totalCredit;
    }

    public long getTotalDebit() {
        return totalDebit;
    }

    public long getTotalCredit() {
        return totalCredit;
    }
}
