package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.agreement.dto.AgreementResponse;
import com.flagship.escrow_engine.agreement.dto.CreateAgreementRequest;
import com.flagship.escrow_engine.agreement.dto.EscrowBalanceResponse;
import com.flagship.escrow_engine.agreement.dto.TransitionResponse;
import com.flagship.escrow_engine.ledger.Identity;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * REST controller for escrow agreements.
 *
 * The caller identity comes from the X-Caller-Identity header, which the
 * authentication layer in front of this service sets. Creation requires an
 * Idempotency-Key header; repeating a key returns the agreement it created.
 */
@RestController
@RequestMapping("/api/agreements")
@RequiredArgsConstructor
@Slf4j
public class AgreementController {

    static final String CALLER_HEADER = "X-Caller-Identity";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final EscrowEngine escrowEngine;
    private final IdempotencyService idempotencyService;
    private final EscrowMetrics escrowMetrics;

    @PostMapping
    public ResponseEntity<AgreementResponse> createAgreement(
            @Valid @RequestBody CreateAgreementRequest request,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received agreement creation request: idempotencyKey={}, buyer={}, amount={}",
                idempotencyKey, request.getBuyer(), request.getAmount());

        Optional<Long> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            escrowMetrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning agreement {}", existingId.get());

            Agreement existing = escrowEngine.getAgreement(existingId.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Agreement found by idempotency key but not found by ID: " + existingId.get()));
            return ResponseEntity.ok(AgreementResponse.from(existing));
        }
        escrowMetrics.recordIdempotencyMiss();

        long agreementId = escrowEngine.createAgreement(
            Identity.of(caller),
            Identity.of(request.getBuyer()),
            request.getAmount(),
            request.getDescription(),
            idempotencyKey);

        idempotencyService.storeIdempotencyKey(idempotencyKey, agreementId);

        Agreement created = escrowEngine.getAgreement(agreementId)
            .orElseThrow(() -> new IllegalStateException("Agreement vanished after creation: " + agreementId));
        return ResponseEntity.status(HttpStatus.CREATED).body(AgreementResponse.from(created));
    }

    @PostMapping("/{id}/fund")
    public ResponseEntity<TransitionResponse> fund(@PathVariable("id") long id,
                                                   @RequestHeader(CALLER_HEADER) String caller) {
        return transition(id, caller, escrowEngine::fundAgreement);
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<TransitionResponse> accept(@PathVariable("id") long id,
                                                     @RequestHeader(CALLER_HEADER) String caller) {
        return transition(id, caller, escrowEngine::acceptAgreement);
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<TransitionResponse> complete(@PathVariable("id") long id,
                                                       @RequestHeader(CALLER_HEADER) String caller) {
        return transition(id, caller, escrowEngine::completeAgreement);
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<TransitionResponse> dispute(@PathVariable("id") long id,
                                                      @RequestHeader(CALLER_HEADER) String caller) {
        return transition(id, caller, escrowEngine::disputeAgreement);
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<TransitionResponse> refund(@PathVariable("id") long id,
                                                     @RequestHeader(CALLER_HEADER) String caller) {
        return transition(id, caller, escrowEngine::refundAgreement);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AgreementResponse> getAgreement(@PathVariable("id") long id) {
        return escrowEngine.getAgreement(id)
            .map(agreement -> ResponseEntity.ok(AgreementResponse.from(agreement)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/escrow-balance")
    public ResponseEntity<EscrowBalanceResponse> getEscrowBalance(@PathVariable("id") long id) {
        return escrowEngine.getEscrowBalance(id)
            .map(balance -> ResponseEntity.ok(EscrowBalanceResponse.from(balance)))
            .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<TransitionResponse> transition(long id, String caller,
                                                          BiFunction<Identity, Long, Boolean> operation) {
        boolean result = operation.apply(Identity.of(caller), id);
        AgreementStatus status = escrowEngine.getAgreement(id)
            .map(Agreement::getStatus)
            .orElseThrow(() -> new IllegalStateException("Agreement vanished after transition: " + id));
        return ResponseEntity.ok(new TransitionResponse(id, result, status));
    }
}
