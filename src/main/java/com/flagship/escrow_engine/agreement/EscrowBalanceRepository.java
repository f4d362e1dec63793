package com.flagship.escrow_engine.agreement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EscrowBalanceRepository extends JpaRepository<EscrowBalanceEntity, Long> {
}
