package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.ledger.Identity;
import lombok.Value;

/**
 * Distinguished identities of an escrow deployment.
 *
 * The arbiter is the only identity allowed to resolve a dispute. Nothing
 * prevents the arbiter from also being a party to an agreement.
 */
@Value
public class EscrowRoles {
    Identity arbiter;

    public boolean isArbiter(Identity identity) {
        return arbiter.equals(identity);
    }
}
