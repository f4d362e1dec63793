package com.flagship.escrow_engine.ledger;

import com.flagship.escrow_engine.ledger.dto.DepositRequest;
import com.flagship.escrow_engine.ledger.dto.DepositResponse;
import com.flagship.escrow_engine.ledger.dto.WalletBalanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Wallet funding and balance lookups.
 *
 * Deposits are posted by the upstream payment integration once money has
 * actually been received; this service does not talk to payment providers.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/deposits")
    public ResponseEntity<DepositResponse> deposit(@Valid @RequestBody DepositRequest request) {
        Identity owner = Identity.of(request.getOwner());
        UUID transactionId = ledgerService.deposit(owner, request.getAmount());

        log.info("Deposit posted: owner={}, amount={}, ledgerTxId={}", owner, request.getAmount(), transactionId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new DepositResponse(transactionId, owner.getPrincipal(), ledgerService.getBalance(owner)));
    }

    @GetMapping("/balances/{owner}")
    public ResponseEntity<WalletBalanceResponse> getBalance(@PathVariable String owner) {
        Identity identity = Identity.of(owner);
        return ResponseEntity.ok(new WalletBalanceResponse(identity.getPrincipal(), ledgerService.getBalance(identity)));
    }
}
