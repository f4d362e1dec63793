package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.agreement.exception.EscrowErrorCode;
import com.flagship.escrow_engine.agreement.exception.EscrowException;
import com.flagship.escrow_engine.ledger.Identity;
import com.flagship.escrow_engine.ledger.LedgerService;
import com.flagship.escrow_engine.outbox.OutboxEvent;
import com.flagship.escrow_engine.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Escrow engine against PostgreSQL: the JPA store, the JDBC ledger and the outbox.
 *
 * These tests verify that:
 * - A full lifecycle moves real ledger balances
 * - A failed transfer rolls back the whole operation, including its outbox event
 * - IDs stay dense under failures and concurrent creates
 * - Concurrent transitions on one agreement are serialized
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class EscrowEngineIntegrationTest {

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
        registry.add("escrow.arbiter", () -> "it-arbiter");
    }

    @Autowired
    private EscrowEngine escrowEngine;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    private Identity vendor;
    private Identity buyer;
    private final Identity arbiter = Identity.of("it-arbiter");

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        vendor = Identity.of("vendor-" + suffix);
        buyer = Identity.of("buyer-" + suffix);

        printInput("Vendor", vendor);
        printInput("Buyer", buyer);
    }

    private List<String> eventTypes(long agreementId) {
        return outboxService.getEventsForAggregate(EscrowEngine.AGGREGATE_TYPE, Long.toString(agreementId))
            .stream()
            .map(OutboxEvent::getEventType)
            .toList();
    }

    @Test
    @DisplayName("Full lifecycle moves ledger balances buyer -> custody -> vendor")
    void testLifecycle_Complete() {
        printTestHeader("Lifecycle - Complete");
        ledgerService.deposit(buyer, 1000);
        long custodyBefore = ledgerService.getBalance(ledgerService.custodyIdentity());

        long id = escrowEngine.createAgreement(vendor, buyer, 1000, "website build", "it-" + UUID.randomUUID());
        escrowEngine.fundAgreement(buyer, id);

        assertEquals(0, ledgerService.getBalance(buyer));
        assertEquals(custodyBefore + 1000, ledgerService.getBalance(ledgerService.custodyIdentity()));
        assertEquals(1000, escrowEngine.getEscrowBalance(id).orElseThrow().getBalance());

        escrowEngine.acceptAgreement(buyer, id);
        escrowEngine.completeAgreement(buyer, id);

        printOutput("Vendor balance", ledgerService.getBalance(vendor));
        assertEquals(AgreementStatus.COMPLETED, escrowEngine.getAgreement(id).orElseThrow().getStatus());
        assertEquals(1000, ledgerService.getBalance(vendor));
        assertEquals(custodyBefore, ledgerService.getBalance(ledgerService.custodyIdentity()));
        assertTrue(escrowEngine.getEscrowBalance(id).isEmpty());

        assertEquals(List.of("AgreementCreated", "AgreementFunded", "AgreementAccepted", "AgreementCompleted"),
            eventTypes(id));
        printSuccess("Funds released and one event per transition written in order");
    }

    @Test
    @DisplayName("Dispute and arbiter refund return funds to the buyer")
    void testLifecycle_Refund() {
        printTestHeader("Lifecycle - Refund");
        ledgerService.deposit(buyer, 1000);

        long id = escrowEngine.createAgreement(vendor, buyer, 1000, "translation", null);
        escrowEngine.fundAgreement(buyer, id);
        escrowEngine.acceptAgreement(buyer, id);
        escrowEngine.disputeAgreement(buyer, id);

        EscrowException rejected = assertThrows(EscrowException.class, () -> escrowEngine.refundAgreement(buyer, id));
        assertEquals(EscrowErrorCode.NOT_AUTHORIZED, rejected.getErrorCode());

        escrowEngine.refundAgreement(arbiter, id);

        assertEquals(AgreementStatus.REFUNDED, escrowEngine.getAgreement(id).orElseThrow().getStatus());
        assertEquals(1000, ledgerService.getBalance(buyer));
        assertEquals(0, ledgerService.getBalance(vendor));
        assertTrue(escrowEngine.getEscrowBalance(id).isEmpty());
        printSuccess("Buyer refunded");
    }

    @Test
    @DisplayName("Insufficient funds rolls back the whole fund operation")
    void testFund_InsufficientFundsRollsBack() {
        printTestHeader("Fund - Insufficient Funds Rollback");
        ledgerService.deposit(buyer, 400);

        long id = escrowEngine.createAgreement(vendor, buyer, 1000, "hardware", null);
        EscrowException exception = assertThrows(EscrowException.class, () -> escrowEngine.fundAgreement(buyer, id));

        printOutput("Error", exception.getMessage());
        assertEquals(EscrowErrorCode.INSUFFICIENT_FUNDS, exception.getErrorCode());
        assertEquals(AgreementStatus.PENDING, escrowEngine.getAgreement(id).orElseThrow().getStatus());
        assertTrue(escrowEngine.getEscrowBalance(id).isEmpty());
        assertEquals(400, ledgerService.getBalance(buyer));
        assertEquals(List.of("AgreementCreated"), eventTypes(id));
        printSuccess("Agreement, custody record, ledger and outbox unchanged");
    }

    @Test
    @DisplayName("A rejected create does not consume an ID")
    void testCreate_DenseIds() {
        long first = escrowEngine.createAgreement(vendor, buyer, 10, "first", null);
        assertThrows(IllegalArgumentException.class,
            () -> escrowEngine.createAgreement(vendor, buyer, -1, "negative", null));
        long second = escrowEngine.createAgreement(vendor, buyer, 10, "second", null);

        assertEquals(first + 1, second);
    }

    @Test
    @DisplayName("Concurrent creates receive distinct consecutive IDs")
    void testCreate_ConcurrentIdsAreDense() throws Exception {
        printTestHeader("Concurrent Creates");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String description = "concurrent-" + i;
                Callable<Long> task = () -> {
                    start.await();
                    return escrowEngine.createAgreement(vendor, buyer, 10, description, null);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<Long> ids = new ArrayList<>();
            for (Future<Long> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS));
            }
            Collections.sort(ids);
            printOutput("IDs", ids);

            for (int i = 1; i < ids.size(); i++) {
                assertEquals(ids.get(i - 1) + 1, ids.get(i), "IDs must be consecutive");
            }
        } finally {
            executor.shutdownNow();
        }
        printSuccess("No gaps and no duplicates");
    }

    @Test
    @DisplayName("Concurrent funding of one agreement succeeds exactly once")
    void testFund_ConcurrentCallsSerialized() throws Exception {
        printTestHeader("Concurrent Funding");
        ledgerService.deposit(buyer, 5000);
        long id = escrowEngine.createAgreement(vendor, buyer, 1000, "race", null);

        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<EscrowErrorCode>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        escrowEngine.fundAgreement(buyer, id);
                        return null;
                    } catch (EscrowException e) {
                        return e.getErrorCode();
                    }
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<EscrowErrorCode> future : futures) {
                EscrowErrorCode code = future.get(30, TimeUnit.SECONDS);
                if (code == null) {
                    successes++;
                } else {
                    assertEquals(EscrowErrorCode.INVALID_STATUS, code);
                }
            }

            assertEquals(1, successes);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(4000, ledgerService.getBalance(buyer));
        assertEquals(1000, escrowEngine.getEscrowBalance(id).orElseThrow().getBalance());
        printSuccess("Buyer debited once");
    }
}
