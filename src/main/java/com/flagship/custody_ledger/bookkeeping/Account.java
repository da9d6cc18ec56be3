package com.flagship.custody_ledger.bookkeeping;

import lombok.Value;

import java.util.UUID;

/**
 * An account in the internal double-entry books.
 *
 * Custody accounts ({@code custody:<ledgerId>}) are ASSET accounts: what the
 * service currently holds for a ledger. Principal wallets ({@code wallet:<principal>})
 * are LIABILITY accounts standing for the outside world.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY;

        /**
         * ASSET balances grow with debits, the others with credits.
         */
        public boolean isDebitNormal() {
            return this == ASSET;
        }
    }

    public static String custodyAccountNumber(UUID ledgerId) {
        return "custody:" + ledgerId;
    }

    public static String walletAccountNumber(String principal) {
        return "wallet:" + principal;
    }
}
