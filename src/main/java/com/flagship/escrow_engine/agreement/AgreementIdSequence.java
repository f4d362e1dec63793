package com.flagship.escrow_engine.agreement;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * The agreement ID counter, a single row in {@code escrow_counters}.
 *
 * Unlike a database sequence, the counter is written inside the creating
 * transaction, so a rolled-back create leaves no gap in the IDs.
 */
@Component
public class AgreementIdSequence {

    private static final String COUNTER_NAME = "agreement";

    private final JdbcTemplate jdbcTemplate;

    public AgreementIdSequence(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Reads the last assigned ID and locks the counter row until the transaction ends.
     */
    public long lastForUpdate() {
        Long value = jdbcTemplate.queryForObject(
            "SELECT value FROM escrow_counters WHERE name = ? FOR UPDATE",
            Long.class,
            COUNTER_NAME
        );
        if (value == null) {
            throw new IllegalStateException("Counter row missing: " + COUNTER_NAME);
        }
        return value;
    }

    public void advanceTo(long agreementId) {
        int updated = jdbcTemplate.update(
            "UPDATE escrow_counters SET value = ? WHERE name = ? AND value < ?",
            agreementId,
            COUNTER_NAME,
            agreementId
        );
        if (updated != 1) {
            throw new IllegalStateException("Counter could not advance to " + agreementId);
        }
    }
}
