package com.flagship.escrow_engine.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Double-entry ledger tests.
 *
 * These tests verify that:
 * - Deposits and transfers move wallet balances
 * - Transfers never overdraw a wallet
 * - Unbalanced transactions are rejected by the service and by the database
 * - Ledger entries cannot be modified
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("escrow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private Identity alice;
    private Identity bob;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExceptionDetails(Exception e) {
        String message = e.getMessage();
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            message = e.getCause().getMessage();
        }
        System.out.println("  Exception Message: " + message);
    }

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        alice = Identity.of("alice-" + suffix);
        bob = Identity.of("bob-" + suffix);
    }

    @Test
    @DisplayName("Deposit credits the wallet and posts a balanced transaction")
    void testDeposit() {
        printTestHeader("Deposit");

        UUID transactionId = ledgerService.deposit(alice, 750);

        List<LedgerEntry> entries = ledgerService.getLedgerEntriesForTransaction(transactionId);
        printOutput("Entries", entries);
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());
        assertEquals(750, ledgerService.getBalance(alice));
        assertEquals(Account.AccountType.LIABILITY,
            accountService.findAccount(alice).orElseThrow().getAccountType());
        printSuccess("Wallet credited");
    }

    @Test
    @DisplayName("Deposit rejects non-positive amounts and the custody account")
    void testDeposit_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> ledgerService.deposit(alice, 0));
        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.deposit(ledgerService.custodyIdentity(), 100));
        assertEquals(0, ledgerService.getBalance(alice));
    }

    @Test
    @DisplayName("Transfer moves value between wallets and opens the destination lazily")
    void testTransfer() {
        ledgerService.deposit(alice, 500);
        assertTrue(accountService.findAccount(bob).isEmpty());

        ledgerService.transfer(200, alice, bob);

        assertEquals(300, ledgerService.getBalance(alice));
        assertEquals(200, ledgerService.getBalance(bob));
    }

    @Test
    @DisplayName("Transfer beyond the balance fails and posts nothing")
    void testTransfer_InsufficientFunds() {
        printTestHeader("Transfer - Insufficient Funds");
        ledgerService.deposit(alice, 100);

        InsufficientFundsException exception = assertThrows(InsufficientFundsException.class,
            () -> ledgerService.transfer(101, alice, bob));

        printExceptionDetails(exception);
        assertEquals(100, exception.getAvailable());
        assertEquals(101, exception.getRequested());
        assertEquals(100, ledgerService.getBalance(alice));
        assertEquals(0, ledgerService.getBalance(bob));
        printSuccess("Balance unchanged");
    }

    @Test
    @DisplayName("An identity without an account has nothing to transfer")
    void testTransfer_UnknownSource() {
        InsufficientFundsException exception = assertThrows(InsufficientFundsException.class,
            () -> ledgerService.transfer(1, alice, bob));

        assertEquals(0, exception.getAvailable());
        assertEquals(alice, exception.getOwner());
    }

    @Test
    @DisplayName("Unbalanced transactions are rejected by the service")
    void testUnbalancedTransaction_Rejected() {
        UUID aliceAccount = accountService.findOrOpenWallet(alice);
        UUID bobAccount = accountService.findOrOpenWallet(bob);

        TransactionRequest request = new TransactionRequest(
            "Unbalanced",
            List.of(TransactionRequest.Posting.of(aliceAccount, 100, "debit")),
            List.of(TransactionRequest.Posting.of(bobAccount, 50, "credit")));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> ledgerService.postTransaction(request));
        assertTrue(exception.getMessage().contains("not balanced"));
    }

    @Test
    @DisplayName("Database trigger rejects unbalanced entries at commit")
    void testUnbalancedTransaction_DatabaseEnforcement() {
        printTestHeader("Unbalanced Transaction - Database Enforcement");
        UUID aliceAccount = accountService.findOrOpenWallet(alice);
        UUID transactionId = UUID.randomUUID();

        RuntimeException exception = assertThrows(RuntimeException.class, () ->
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update(
                    "INSERT INTO ledger_transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
                    transactionId, "bypass");
                jdbcTemplate.update(
                    "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) "
                        + "VALUES (gen_random_uuid(), ?, ?, 100, 'DEBIT', 'one-sided', CURRENT_TIMESTAMP)",
                    transactionId, aliceAccount);
            }));

        printExceptionDetails(exception);
        assertTrue(ledgerService.getLedgerEntriesForTransaction(transactionId).isEmpty());
        printSuccess("Commit rejected by the deferred trigger");
    }

    @Test
    @DisplayName("Ledger entries cannot be updated")
    void testEntriesImmutable() {
        UUID transactionId = ledgerService.deposit(alice, 10);

        assertThrows(RuntimeException.class, () -> jdbcTemplate.update(
            "UPDATE ledger_entries SET amount = 999 WHERE transaction_id = ?", transactionId));
        assertEquals(10, ledgerService.getBalance(alice));
    }
}
