package com.flagship.custody_ledger.bookkeeping;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Opens accounts in the internal books on first use.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Account> findByNumber(String accountNumber) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, account_number, account_type FROM accounts WHERE account_number = ?",
            (rs, rowNum) -> new Account(
                rs.getObject("id", UUID.class),
                rs.getString("account_number"),
                Account.AccountType.valueOf(rs.getString("account_type"))),
            accountNumber
        );
        return accounts.stream().findFirst();
    }

    /**
     * Returns the account with this number, creating it if needed. Safe under
     * concurrent first use: the loser of the insert race reads the winner's row.
     */
    public Account findOrCreate(String accountNumber, Account.AccountType accountType) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, account_type, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT (account_number) DO NOTHING",
            UUID.randomUUID(),
            accountNumber,
            accountType.name()
        );
        Account account = findByNumber(accountNumber)
            .orElseThrow(() -> new IllegalStateException("Account vanished after insert: " + accountNumber));
        if (account.getAccountType() != accountType) {
            throw new IllegalStateException(String.format(
                "Account %s exists with type %s, expected %s",
                accountNumber, account.getAccountType(), accountType));
        }
        return account;
    }
}
