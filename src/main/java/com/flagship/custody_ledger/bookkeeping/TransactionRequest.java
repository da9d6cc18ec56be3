package com.flagship.custody_ledger.bookkeeping;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A set of posting legs that must balance: total debits equal total credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<Leg> legs;

    /**
     * The common two-leg case: move {@code amount} from {@code creditAccount} to
     * {@code debitAccount}.
     */
    public static TransactionRequest transfer(String description, UUID debitAccount,
                                              UUID creditAccount, BigDecimal amount) {
        return new TransactionRequest(description, List.of(
                Leg.of(debitAccount, EntryType.DEBIT, amount),
                Leg.of(creditAccount, EntryType.CREDIT, amount)
        ));
    }

    public BigDecimal total(EntryType side) {
        return legs.stream()
                .filter(leg -> leg.getEntryType() == side)
                .map(Leg::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return total(EntryType.DEBIT).compareTo(total(EntryType.CREDIT)) == 0;
    }

    @Value
    public static class Leg {
        UUID accountId;
        EntryType entryType;
        BigDecimal amount;

        private Leg(UUID accountId, EntryType entryType, BigDecimal amount) {
            this.accountId = Objects.requireNonNull(accountId);
            this.entryType = Objects.requireNonNull(entryType);
            this.amount = Objects.requireNonNull(amount);
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Posting amount must be positive");
            }
        }

        public static Leg of(UUID accountId, EntryType entryType, BigDecimal amount) {
            return new Leg(accountId, entryType, amount);
        }
    }
}
