package com.flagship.tenant_ledger.ledger;

import com.flagship.tenant_ledger.ledger.exception.EmptyPostingException;
import com.flagship.tenant_ledger.ledger.exception.InvalidAmountException;
import com.flagship.tenant_ledger.ledger.exception.UnbalancedPostingException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;

import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Validates a posting request before anything is written.
 *
 * Checks run in a fixed order and the first failure wins:
 * 1. EmptyPosting - no lines
 * 2. UnbalancedPosting - total debits differ from total credits
 * 3. UnknownAccount - a line's account is not an active account of the tenant
 * 4. InvalidAmount - a negative amount, or a line with both or neither side set
 *
 * Totals are summed with exact arithmetic; an overflow is an InvalidAmount.
 */
public final class PostingValidator {

    private PostingValidator() {
    }

    public static void validate(PostingRequest request, Predicate<UUID> accountUsable) {
        List<PostingLine> lines = request.getLines();
        if (lines == null || lines.isEmpty()) {
            throw new EmptyPostingException();
        }

        long totalDebit = 0;
        long totalCredit = 0;
        try {
            for (PostingLine line : lines) {
                totalDebit = Math.addExact(totalDebit, line.getDebit());
                totalCredit = Math.addExact(totalCredit, line.getCredit());
            }
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Posting totals overflow");
        }
        if (totalDebit != totalCredit) {
            throw new UnbalancedPostingException(totalDebit, totalCredit);
        }

        for (PostingLine line : lines) {
            if (line.getAccountId() == null || !accountUsable.test(line.getAccountId())) {
                throw new UnknownAccountException(line.getAccountId());
            }
        }

        for (int i = 0; i < lines.size(); i++) {
            PostingLine line = lines.get(i);
            if (line.getDebit() < 0 || line.getCredit() < 0) {
                throw new InvalidAmountException("Line " + (i + 1) + " has a negative amount");
            }
            if (line.getDebit() > 0 && line.getCredit() > 0) {
                throw new InvalidAmountException("Line " + (i + 1) + " has both a debit and a credit");
            }
            if (line.getDebit() == 0 && line.getCredit() == 0) {
                throw new InvalidAmountException("Line " + (i + 1) + " has neither a debit nor a credit");
            }
        }
    }
}
