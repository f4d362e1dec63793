package com.flagship.escrow_engine.config;

import com.flagship.escrow_engine.agreement.EscrowRoles;
import com.flagship.escrow_engine.ledger.Identity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Escrow deployment configuration.
 *
 * - escrow.arbiter: identity allowed to refund disputed agreements
 * - Clock used to timestamp agreement creation (UTC)
 */
@Configuration
public class EscrowConfig {

    @Bean
    public EscrowRoles escrowRoles(@Value("${escrow.arbiter:escrow-arbiter}") String arbiter) {
        return new EscrowRoles(Identity.of(arbiter));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
