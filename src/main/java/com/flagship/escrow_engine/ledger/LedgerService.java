package com.flagship.escrow_engine.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Double-entry ledger backing the escrow engine's {@link LedgerGateway}.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions)
 * 2. Ledger entries are immutable once written
 * 3. A wallet is never debited below zero
 *
 * Balances are derived from entries, never stored. Debiting a wallet locks its
 * account row first, so the balance check and the posting see the same state.
 */
@Service
@Slf4j
public class LedgerService implements LedgerGateway {

    private static final Identity RESERVE = Identity.of("ledger-reserve");

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final Identity custodyIdentity;

    public LedgerService(JdbcTemplate jdbcTemplate,
                         AccountService accountService,
                         @Value("${escrow.custody-identity:escrow-custody}") String custodyIdentity) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
        this.custodyIdentity = Identity.of(custodyIdentity);
    }

    @Override
    public Identity custodyIdentity() {
        return custodyIdentity;
    }

    @Override
    @Transactional
    public UUID transfer(long amount, Identity from, Identity to) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive");
        }

        Account source = accountService.findAccountForUpdate(from)
            .orElseThrow(() -> new InsufficientFundsException(from, amount, 0));

        long available = getAccountBalance(source.getId());
        if (available < amount) {
            log.warn("Transfer rejected: from={}, to={}, amount={}, available={}", from, to, amount, available);
            throw new InsufficientFundsException(from, amount, available);
        }

        UUID destinationId = accountService.findOrOpenWallet(to);
        UUID transactionId = postTransaction(TransactionRequest.transfer(
            String.format("Transfer %s -> %s", from, to), source.getId(), destinationId, amount));

        log.debug("Transfer posted: ledgerTxId={}, from={}, to={}, amount={}", transactionId, from, to, amount);
        return transactionId;
    }

    /**
     * Credits an identity's wallet with newly deposited value, balanced against the reserve.
     *
     * @return The UUID of the created ledger transaction
     */
    @Transactional
    public UUID deposit(Identity owner, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        if (owner.equals(custodyIdentity) || owner.equals(RESERVE)) {
            throw new IllegalArgumentException("Deposits go to wallets only, not to " + owner);
        }
        UUID reserveId = accountService.findAccount(RESERVE)
            .map(Account::getId)
            .orElseGet(() -> accountService.openAccount(RESERVE, Account.AccountType.ASSET));
        UUID walletId = accountService.findOrOpenWallet(owner);

        return postTransaction(TransactionRequest.transfer(
            "Deposit to " + owner, reserveId, walletId, amount));
    }

    /**
     * Posts a balanced transaction to the ledger.
     *
     * The deferred database trigger re-checks the balance at commit time.
     *
     * @throws IllegalArgumentException if the transaction is not balanced or an account is unknown
     */
    @Transactional
    public UUID postTransaction(TransactionRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%d, credits=%d",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        validateAccountsExist(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription()
        );

        for (TransactionRequest.Posting debit : request.getDebits()) {
            createLedgerEntry(transactionId, debit, EntryType.DEBIT);
        }
        for (TransactionRequest.Posting credit : request.getCredits()) {
            createLedgerEntry(transactionId, credit, EntryType.CREDIT);
        }

        return transactionId;
    }

    /**
     * Balance of an identity's wallet; zero if it has never held value.
     */
    public long getBalance(Identity owner) {
        return accountService.findAccount(owner)
            .map(account -> getAccountBalance(account.getId()))
            .orElse(0L);
    }

    /**
     * Derives an account balance from its entries.
     * ASSET: debits increase. LIABILITY: credits increase.
     */
    public long getAccountBalance(UUID accountId) {
        String accountType = jdbcTemplate.queryForObject(
            "SELECT account_type FROM ledger_accounts WHERE id = ?",
            String.class,
            accountId
        );

        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE " +
            "  WHEN ? = 'ASSET' THEN CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END " +
            "  ELSE CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END " +
            "  END), 0) " +
            "FROM ledger_entries WHERE account_id = ?",
            Long.class,
            accountType,
            accountId
        );

        return balance != null ? balance : 0L;
    }

    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    private void createLedgerEntry(UUID transactionId, TransactionRequest.Posting posting, EntryType entryType) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            posting.getAccountId(),
            posting.getAmount(),
            entryType.name(),
            posting.getDescription()
        );
    }

    private void validateAccountsExist(TransactionRequest request) {
        List<UUID> accountIds = new ArrayList<>();
        request.getDebits().forEach(p -> accountIds.add(p.getAccountId()));
        request.getCredits().forEach(p -> accountIds.add(p.getAccountId()));

        for (UUID accountId : accountIds) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_accounts WHERE id = ?",
                Integer.class,
                accountId
            );
            if (count == null || count == 0) {
                throw new IllegalArgumentException("Account not found: " + accountId);
            }
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getLong("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
