package com.coopvault.settlement;

import com.coopvault.common.Money;

/**
 * Custody and settlement rail for the external reserve currency.
 *
 * The rail holds the vault's reserve currency and is the authority on the live
 * custody balance. The vault keeps its own cached reserve figure and checks both.
 *
 * Implementations may talk to a custodian API or an on-chain settlement contract.
 * Every call can fail with {@link SettlementRailException}; such failures are
 * retryable and callers must leave their own state unchanged when one occurs.
 */
public interface SettlementRail {

    /**
     * Live balance of reserve currency held in custody for the vault.
     *
     * @throws SettlementRailException if the rail is unavailable
     */
    Money getCustodyBalance();

    /**
     * Pay reserve currency out of custody to a destination.
     *
     * MUST be idempotent: repeating a call with the same referenceId is a no-op
     * returning the original confirmation.
     *
     * @return rail confirmation id
     * @throws SettlementRailException if the rail is unavailable or rejects the payout
     */
    String payOut(String destination, Money amount, String referenceId);

    /**
     * Collect reserve currency from a source into custody.
     *
     * MUST be idempotent on referenceId.
     *
     * @return rail confirmation id
     * @throws SettlementRailException if the rail is unavailable or the source cannot pay
     */
    String collect(String source, Money amount, String referenceId);

    String getRailName();

    boolean isHealthy();
}
