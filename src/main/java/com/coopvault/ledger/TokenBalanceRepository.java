package com.coopvault.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Repository for account balances.
 */
@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM TokenBalance b WHERE b.accountId = :accountId")
    Optional<TokenBalance> findForUpdate(@Param("accountId") String accountId);

    @Query("SELECT SUM(b.balance.amount) FROM TokenBalance b")
    BigDecimal sumBalances();
}
