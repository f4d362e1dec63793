package com.flagship.escrow_engine.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing ledger accounts, one per identity.
 * Accounts are opened lazily the first time an identity receives value.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID openAccount(Identity owner, Account.AccountType accountType) {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_accounts (id, owner, account_type, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            owner.getPrincipal(),
            accountType.name()
        );
        return accountId;
    }

    public Optional<Account> findAccount(Identity owner) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, owner, account_type FROM ledger_accounts WHERE owner = ?",
            accountRowMapper(),
            owner.getPrincipal()
        );
        return accounts.stream().findFirst();
    }

    /**
     * Finds the owner's account and locks its row until the current transaction ends,
     * so concurrent debits of the same account are applied one at a time.
     */
    @Transactional
    public Optional<Account> findAccountForUpdate(Identity owner) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, owner, account_type FROM ledger_accounts WHERE owner = ? FOR UPDATE",
            accountRowMapper(),
            owner.getPrincipal()
        );
        return accounts.stream().findFirst();
    }

    @Transactional
    public UUID findOrOpenWallet(Identity owner) {
        return findAccount(owner)
            .map(Account::getId)
            .orElseGet(() -> openAccount(owner, Account.AccountType.LIABILITY));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            Identity.of(rs.getString("owner")),
            Account.AccountType.valueOf(rs.getString("account_type"))
        );
    }
}
