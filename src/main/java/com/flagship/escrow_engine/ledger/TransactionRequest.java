package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Debits and credits to post as one ledger transaction.
 *
 * Invariant: sum of debits equals sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<Posting> debits;
    List<Posting> credits;

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return debits.stream().mapToLong(Posting::getAmount).sum();
    }

    public long getCreditTotal() {
        return credits.stream().mapToLong(Posting::getAmount).sum();
    }

    /**
     * Creates the two-legged request used for a plain transfer between two accounts.
     */
    public static TransactionRequest transfer(String description, UUID fromAccountId,
                                              UUID toAccountId, long amount) {
        return new TransactionRequest(
            description,
            List.of(Posting.of(fromAccountId, amount, description + ": debit")),
            List.of(Posting.of(toAccountId, amount, description + ": credit"))
        );
    }

    /**
     * A single debit or credit line.
     */
    @Value
    public static class Posting {
        UUID accountId;
        long amount;
        String description;

        private Posting(UUID accountId, long amount, String description) {
            this.accountId = Objects.requireNonNull(accountId);
            if (amount <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.amount = amount;
            this.description = description;
        }

        public static Posting of(UUID accountId, long amount, String description) {
            return new Posting(accountId, amount, description);
        }
    }
}
