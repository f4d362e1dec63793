package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.agreement.event.AgreementCreatedEvent;
import com.flagship.escrow_engine.agreement.event.AgreementEvent;
import com.flagship.escrow_engine.agreement.event.AgreementTransitionedEvent;
import com.flagship.escrow_engine.agreement.exception.EscrowException;
import com.flagship.escrow_engine.ledger.Identity;
import com.flagship.escrow_engine.ledger.InsufficientFundsException;
import com.flagship.escrow_engine.ledger.LedgerGateway;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The escrow agreement state machine.
 *
 * | Operation | From     | Caller  | Effect                                  | To        |
 * |-----------|----------|---------|-----------------------------------------|-----------|
 * | create    | -        | anyone  | allocate next ID (caller is the vendor) | PENDING   |
 * | fund      | PENDING  | buyer   | buyer -> custody, open escrow balance   | FUNDED    |
 * | accept    | FUNDED   | buyer   | -                                       | ACCEPTED  |
 * | complete  | ACCEPTED | buyer   | custody -> vendor, close escrow balance | COMPLETED |
 * | dispute   | ACCEPTED | buyer   | -                                       | DISPUTED  |
 * | refund    | DISPUTED | arbiter | custody -> buyer, close escrow balance  | REFUNDED  |
 *
 * Every transition checks existence, then authorization, then status, and
 * only then moves funds and writes. Each operation is one transaction: a
 * failed transfer leaves the agreement, its escrow balance and the outbox
 * exactly as they were.
 *
 * The caller identity is passed in explicitly; the engine trusts it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowEngine {

    static final String AGGREGATE_TYPE = "Agreement";

    private final AgreementStore store;
    private final LedgerGateway ledger;
    private final EscrowRoles roles;
    private final Clock clock;
    private final OutboxService outboxService;
    private final EscrowMetrics metrics;

    /**
     * Creates an agreement in PENDING status with the caller as vendor.
     *
     * @param caller Identity creating the agreement; becomes the vendor
     * @param buyer Identity that will fund, accept, complete or dispute
     * @param amount Amount the buyer must deposit
     * @param description Free text, at most 256 characters
     * @param idempotencyKey Key of the originating request, or null
     * @return The new agreement ID, one more than the previous one
     * @throws EscrowException ALREADY_EXISTS if the next ID is already taken
     * @throws IllegalArgumentException if an argument is missing or out of range
     */
    @Transactional
    public long createAgreement(Identity caller, Identity buyer, long amount,
                                String description, String idempotencyKey) {
        return execute("create", null, caller, () -> {
            long agreementId = store.lastAgreementId() + 1;
            MDC.put(CorrelationContext.AGREEMENT_ID_MDC_KEY, Long.toString(agreementId));

            if (store.exists(agreementId)) {
                throw EscrowException.alreadyExists(agreementId);
            }

            Agreement agreement = Agreement.create(agreementId, caller, buyer, amount, description, clock.instant());
            store.insert(agreement, idempotencyKey);
            store.recordAgreementId(agreementId);

            publish(AgreementCreatedEvent.fromAgreement(agreement));

            afterCommit(() -> log.info("Agreement created: vendor={}, buyer={}, amount={}", caller, buyer, amount));
            return agreementId;
        });
    }

    /**
     * Moves the agreement amount from the buyer into custody.
     *
     * @throws EscrowException NOT_FOUND, NOT_AUTHORIZED (caller is not the buyer),
     *         INVALID_STATUS (not PENDING) or INSUFFICIENT_FUNDS
     */
    @Transactional
    public boolean fundAgreement(Identity caller, long agreementId) {
        return execute("fund", agreementId, caller, () -> {
            Agreement agreement = loadForTransition(agreementId, caller, Role.BUYER, AgreementStatus.PENDING);

            Identity custody = ledger.custodyIdentity();
            UUID ledgerTransactionId = transfer(agreementId, agreement.getAmount(), agreement.getBuyer(), custody);

            Agreement funded = agreement.fund();
            store.updateStatus(funded);
            store.saveEscrowBalance(new EscrowBalance(agreementId, agreement.getAmount()));
            metrics.recordCustodyIn(agreement.getAmount());

            publish(AgreementTransitionedEvent.withTransfer(agreement.getStatus(), funded, caller,
                agreement.getBuyer(), custody, ledgerTransactionId, clock.instant()));

            afterCommit(() -> log.info("Agreement funded: amount={}, ledgerTxId={}",
                agreement.getAmount(), ledgerTransactionId));
            return true;
        });
    }

    /**
     * Buyer acknowledges a funded agreement.
     *
     * @throws EscrowException NOT_FOUND, NOT_AUTHORIZED or INVALID_STATUS (not FUNDED)
     */
    @Transactional
    public boolean acceptAgreement(Identity caller, long agreementId) {
        return execute("accept", agreementId, caller, () -> {
            Agreement agreement = loadForTransition(agreementId, caller, Role.BUYER, AgreementStatus.FUNDED);

            Agreement accepted = agreement.accept();
            store.updateStatus(accepted);

            publish(AgreementTransitionedEvent.of(agreement.getStatus(), accepted, caller, clock.instant()));

            afterCommit(() -> log.info("Agreement accepted"));
            return true;
        });
    }

    /**
     * Releases custody to the vendor and closes the escrow balance.
     *
     * @throws EscrowException NOT_FOUND, NOT_AUTHORIZED, INVALID_STATUS (not ACCEPTED)
     *         or INSUFFICIENT_FUNDS
     */
    @Transactional
    public boolean completeAgreement(Identity caller, long agreementId) {
        return execute("complete", agreementId, caller, () -> {
            Agreement agreement = loadForTransition(agreementId, caller, Role.BUYER, AgreementStatus.ACCEPTED);
            Agreement completed = agreement.complete();

            releaseCustody(agreement, completed, caller, agreement.getVendor());

            afterCommit(() -> log.info("Agreement completed: released to vendor={}", agreement.getVendor()));
            return true;
        });
    }

    /**
     * Buyer disputes an accepted agreement; funds stay in custody for the arbiter.
     *
     * @throws EscrowException NOT_FOUND, NOT_AUTHORIZED or INVALID_STATUS (not ACCEPTED)
     */
    @Transactional
    public boolean disputeAgreement(Identity caller, long agreementId) {
        return execute("dispute", agreementId, caller, () -> {
            Agreement agreement = loadForTransition(agreementId, caller, Role.BUYER, AgreementStatus.ACCEPTED);

            Agreement disputed = agreement.dispute();
            store.updateStatus(disputed);

            publish(AgreementTransitionedEvent.of(agreement.getStatus(), disputed, caller, clock.instant()));

            afterCommit(() -> log.info("Agreement disputed"));
            return true;
        });
    }

    /**
     * Arbiter resolves a dispute by returning custody to the buyer.
     *
     * @throws EscrowException NOT_FOUND, NOT_AUTHORIZED (caller is not the arbiter),
     *         INVALID_STATUS (not DISPUTED) or INSUFFICIENT_FUNDS
     */
    @Transactional
    public boolean refundAgreement(Identity caller, long agreementId) {
        return execute("refund", agreementId, caller, () -> {
            Agreement agreement = loadForTransition(agreementId, caller, Role.ARBITER, AgreementStatus.DISPUTED);
            Agreement refunded = agreement.refund();

            releaseCustody(agreement, refunded, caller, agreement.getBuyer());

            afterCommit(() -> log.info("Agreement refunded: returned to buyer={}", agreement.getBuyer()));
            return true;
        });
    }

    @Transactional(readOnly = true)
    public Optional<Agreement> getAgreement(long agreementId) {
        return store.findById(agreementId);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowBalance> getEscrowBalance(long agreementId) {
        return store.findEscrowBalance(agreementId);
    }

    /**
     * Existence, then authorization, then status. The first failing check aborts.
     */
    private Agreement loadForTransition(long agreementId, Identity caller, Role role, AgreementStatus required) {
        Agreement agreement = store.findByIdForUpdate(agreementId)
            .orElseThrow(() -> EscrowException.notFound(agreementId));

        boolean authorized = switch (role) {
            case BUYER -> agreement.isBuyer(caller);
            case ARBITER -> roles.isArbiter(caller);
        };
        if (!authorized) {
            throw EscrowException.notAuthorized(agreementId, caller, role.label);
        }

        agreement.requireStatus(required);
        return agreement;
    }

    private void releaseCustody(Agreement agreement, Agreement released, Identity caller, Identity recipient) {
        long agreementId = agreement.getId();
        EscrowBalance escrowBalance = store.findEscrowBalance(agreementId)
            .orElseThrow(() -> new IllegalStateException(
                "Agreement " + agreementId + " is " + agreement.getStatus() + " but holds no escrow balance"));

        Identity custody = ledger.custodyIdentity();
        UUID ledgerTransactionId = transfer(agreementId, escrowBalance.getBalance(), custody, recipient);

        store.updateStatus(released);
        store.deleteEscrowBalance(agreementId);
        metrics.recordCustodyOut(escrowBalance.getBalance());

        publish(AgreementTransitionedEvent.withTransfer(agreement.getStatus(), released, caller,
            custody, recipient, ledgerTransactionId, clock.instant()));
    }

    private UUID transfer(long agreementId, long amount, Identity from, Identity to) {
        try {
            return ledger.transfer(amount, from, to);
        } catch (InsufficientFundsException e) {
            throw EscrowException.insufficientFunds(agreementId, e);
        }
    }

    private void publish(AgreementEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, Long.toString(event.getAgreementId()),
            event.getEventType(), event);
    }

    private <T> T execute(String operation, Long agreementId, Identity caller, Supplier<T> action) {
        if (caller == null) {
            throw new IllegalArgumentException("Caller identity is required");
        }

        long startTime = System.currentTimeMillis();
        if (agreementId != null) {
            MDC.put(CorrelationContext.AGREEMENT_ID_MDC_KEY, agreementId.toString());
        }
        MDC.put(CorrelationContext.CALLER_MDC_KEY, caller.getPrincipal());

        try {
            T result = action.get();
            afterCommit(() -> metrics.recordTransition(operation, "success"));
            onRollback(() -> {
                metrics.recordTransition(operation, "commit_failed");
                log.error("Agreement {} rolled back at commit", operation);
            });
            return result;

        } catch (EscrowException e) {
            metrics.recordTransition(operation, e.getErrorCode().name().toLowerCase(Locale.ROOT));
            log.warn("Agreement {} rejected: code={}, reason={}", operation, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordTransition(operation, "invalid_argument");
            log.warn("Agreement {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordTransition(operation, "error");
            log.error("Agreement {} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.AGREEMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CALLER_MDC_KEY);
        }
    }

    /**
     * Runs {@code action} once the surrounding transaction commits, with the
     * MDC of the calling thread. Without a transaction it runs immediately.
     */
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        Map<String, String> context = MDC.getCopyOfContextMap();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                withContext(context, action);
            }
        });
    }

    private static void onRollback(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        Map<String, String> context = MDC.getCopyOfContextMap();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    withContext(context, action);
                }
            }
        });
    }

    private static void withContext(Map<String, String> context, Runnable action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private enum Role {
        BUYER("buyer"),
        ARBITER("arbiter");

        private final String label;

        Role(String label) {
            this.label = label;
        }
    }
}
