package com.flagship.custody_ledger.bookkeeping;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Posts balanced transactions to the internal books.
 *
 * Invariants:
 * 1. Debits equal credits, checked here and again by a deferred database trigger
 * 2. Entries are insert-only
 * 3. Balances are derived from entries, never stored
 */
@Service
public class BookkeepingService {

    private static final RowMapper<LedgerEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> new LedgerEntry(
        rs.getObject("id", UUID.class),
        rs.getObject("transaction_id", UUID.class),
        rs.getObject("account_id", UUID.class),
        rs.getBigDecimal("amount"),
        EntryType.valueOf(rs.getString("entry_type")),
        rs.getString("description"),
        rs.getLong("sequence_number")
    );

    private final JdbcTemplate jdbcTemplate;

    public BookkeepingService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return id of the posted transaction
     * @throws IllegalArgumentException if the legs do not balance
     */
    @Transactional
    public UUID post(TransactionRequest request) {
        if (request.getLegs().isEmpty() || !request.isBalanced()) {
            throw new IllegalArgumentException(String.format(
                "Transaction is not balanced: debits=%s, credits=%s",
                request.total(EntryType.DEBIT), request.total(EntryType.CREDIT)));
        }

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription()
        );

        for (TransactionRequest.Leg leg : request.getLegs()) {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                UUID.randomUUID(),
                transactionId,
                leg.getAccountId(),
                leg.getAmount(),
                leg.getEntryType().name(),
                request.getDescription()
            );
        }

        return transactionId;
    }

    /**
     * Balance in the account's normal direction: debits minus credits for ASSET
     * accounts, credits minus debits otherwise.
     */
    public BigDecimal balanceOf(Account account) {
        String increasing = account.getAccountType().isDebitNormal() ? "DEBIT" : "CREDIT";
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = ? THEN amount ELSE -amount END), 0) " +
            "FROM ledger_entries WHERE account_id = ?",
            BigDecimal.class,
            increasing,
            account.getId()
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    public List<LedgerEntry> entriesFor(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            ENTRY_ROW_MAPPER,
            transactionId
        );
    }
}
