package com.flagship.tenant_ledger.reconciliation;

import java.util.List;

/**
 * Finds the longest chronological prefix of unreconciled movements that
 * brings the already-reconciled balance to the statement balance.
 *
 * All amounts are in the account's normal-balance sign. An empty prefix
 * matches when the reconciled balance already equals the statement.
 */
final class ReconciliationMatcher {

    private ReconciliationMatcher() {
    }

    static Match match(long reconciledBalance, List<Long> movements, long closingBalance) {
        long running = reconciledBalance;
        int matchedCount = running == closingBalance ? 0 : -1;
        long matchedTotal = 0;
        long cumulative = 0;
        for (int i = 0; i < movements.size(); i++) {
            cumulative = Math.addExact(cumulative, movements.get(i));
            running = Math.addExact(reconciledBalance, cumulative);
            if (running == closingBalance) {
                matchedCount = i + 1;
                matchedTotal = cumulative;
            }
        }
        // running now holds the book balance as of the statement date
        return new Match(matchedCount, matchedTotal, running);
    }

    /**
     * @param matchedCount length of the matching prefix, or -1 when no prefix matches
     * @param matchedTotal net movement of the matching prefix
     * @param bookBalance reconciled balance plus every candidate movement
     */
    record Match(int matchedCount, long matchedTotal, long bookBalance) {

        boolean found() {
            return matchedCount >= 0;
        }
    }
}
