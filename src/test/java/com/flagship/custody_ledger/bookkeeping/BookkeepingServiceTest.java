package com.flagship.custody_ledger.bookkeeping;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Try to break the books behind the custody substrate:
 * - imbalanced postings
 * - editing or deleting entries
 * - accounts reopened with a different type
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class BookkeepingServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("custody_books_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private BookkeepingService bookkeepingService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Account custody;
    private Account wallet;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        custody = accountService.findOrCreate("custody:test-" + suffix, Account.AccountType.ASSET);
        wallet = accountService.findOrCreate("wallet:test-" + suffix, Account.AccountType.LIABILITY);
    }

    private int entryCount() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_entries WHERE account_id IN (?, ?)",
                Integer.class, custody.getId(), wallet.getId());
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("A balanced transfer moves value in each account's normal direction")
    void balancedTransfer() {
        UUID transactionId = bookkeepingService.post(
                TransactionRequest.transfer("deposit", custody.getId(), wallet.getId(), new BigDecimal("30.00")));

        List<LedgerEntry> entries = bookkeepingService.entriesFor(transactionId);
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());

        assertEquals(0, new BigDecimal("30").compareTo(bookkeepingService.balanceOf(custody)));
        assertEquals(0, new BigDecimal("30").compareTo(bookkeepingService.balanceOf(wallet)));
    }

    @Test
    @DisplayName("Imbalanced legs are refused before anything is written")
    void imbalancedRefused() {
        TransactionRequest lopsided = new TransactionRequest("lopsided", List.of(
                TransactionRequest.Leg.of(custody.getId(), EntryType.DEBIT, new BigDecimal("10")),
                TransactionRequest.Leg.of(wallet.getId(), EntryType.CREDIT, new BigDecimal("9.99"))));

        assertThrows(IllegalArgumentException.class, () -> bookkeepingService.post(lopsided));
        assertEquals(0, entryCount());
    }

    @Test
    @DisplayName("Non-positive legs cannot be built")
    void nonPositiveLeg() {
        assertThrows(IllegalArgumentException.class,
                () -> TransactionRequest.Leg.of(custody.getId(), EntryType.DEBIT, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("The database refuses a one-legged transaction at commit")
    void databaseRefusesOneLeggedTransaction() {
        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO transactions (id, description, created_at) "
                + "VALUES (?, 'one-legged', CURRENT_TIMESTAMP)", transactionId);

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, created_at) "
                        + "VALUES (?, ?, ?, 10, 'DEBIT', CURRENT_TIMESTAMP)",
                UUID.randomUUID(), transactionId, custody.getId()));
        assertEquals(0, entryCount());
    }

    @Test
    @DisplayName("Entries cannot be edited or deleted")
    void entriesAreInsertOnly() {
        UUID transactionId = bookkeepingService.post(
                TransactionRequest.transfer("deposit", custody.getId(), wallet.getId(), new BigDecimal("5")));

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE ledger_entries SET amount = 500 WHERE transaction_id = ?", transactionId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM ledger_entries WHERE transaction_id = ?", transactionId));

        assertEquals(0, new BigDecimal("5").compareTo(bookkeepingService.balanceOf(custody)));
    }

    @Test
    @DisplayName("Reopening an account returns the same row and refuses a type change")
    void findOrCreateIsStable() {
        Account again = accountService.findOrCreate(custody.getAccountNumber(), Account.AccountType.ASSET);
        assertEquals(custody.getId(), again.getId());

        assertThrows(IllegalStateException.class,
                () -> accountService.findOrCreate(custody.getAccountNumber(), Account.AccountType.LIABILITY));
    }
}
