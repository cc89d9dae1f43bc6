package com.coopvault.settlement.mock;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.settlement.SettlementRail;
import com.coopvault.settlement.SettlementRailException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process settlement rail for development and testing.
 *
 * Keeps the custody balance and external wallet balances in memory. Payouts and
 * collections are idempotent on their reference id. Failure scenarios are simulated
 * with {@link #setHealthy(boolean)}.
 *
 * NOT FOR PRODUCTION: a deployment replaces this bean with a real custody adapter.
 */
@Component
@Slf4j
public class MockSettlementRail implements SettlementRail {

    private final BigDecimal initialCustodyBalance;

    private BigDecimal custodyBalance;

    // External wallet balances (principal -> USDC)
    private final Map<String, BigDecimal> walletBalances = new ConcurrentHashMap<>();

    // Completed payouts and collections (referenceId -> record)
    private final Map<String, Movement> payouts = new ConcurrentHashMap<>();
    private final Map<String, Movement> collections = new ConcurrentHashMap<>();

    private volatile boolean healthy = true;

    private volatile boolean rejectPayouts = false;

    public MockSettlementRail(
            @Value("${coop-vault.settlement.initial-custody-balance:0}") BigDecimal initialCustodyBalance) {
        this.initialCustodyBalance = initialCustodyBalance;
        this.custodyBalance = initialCustodyBalance;
    }

    @Override
    public synchronized Money getCustodyBalance() {
        requireHealthy(null, "getCustodyBalance");
        return Money.of(custodyBalance, Currency.USDC);
    }

    @Override
    public synchronized String payOut(String destination, Money amount, String referenceId) {
        log.info("Mock: Paying out {} to {}, ref={}", amount, destination, referenceId);
        requireHealthy(referenceId, "payOut");
        if (rejectPayouts) {
            throw new SettlementRailException("Payout rejected by rail", referenceId, "payOut");
        }

        Movement existing = payouts.get(referenceId);
        if (existing != null) {
            log.debug("Payout already executed: {}", referenceId);
            return existing.confirmation;
        }

        if (custodyBalance.compareTo(amount.getAmount()) < 0) {
            throw new SettlementRailException(
                "Custody balance " + custodyBalance + " cannot cover payout " + amount, referenceId, "payOut");
        }

        custodyBalance = custodyBalance.subtract(amount.getAmount());
        walletBalances.merge(destination, amount.getAmount(), BigDecimal::add);

        Movement movement = new Movement(destination, amount.getAmount());
        payouts.put(referenceId, movement);
        return movement.confirmation;
    }

    @Override
    public synchronized String collect(String source, Money amount, String referenceId) {
        log.info("Mock: Collecting {} from {}, ref={}", amount, source, referenceId);
        requireHealthy(referenceId, "collect");

        Movement existing = collections.get(referenceId);
        if (existing != null) {
            log.debug("Collection already executed: {}", referenceId);
            return existing.confirmation;
        }

        BigDecimal available = walletBalances.getOrDefault(source, BigDecimal.ZERO);
        if (available.compareTo(amount.getAmount()) < 0) {
            throw new SettlementRailException(
                "Wallet " + source + " holds " + available + ", cannot pay " + amount, referenceId, "collect");
        }

        walletBalances.put(source, available.subtract(amount.getAmount()));
        custodyBalance = custodyBalance.add(amount.getAmount());

        Movement movement = new Movement(source, amount.getAmount());
        collections.put(referenceId, movement);
        return movement.confirmation;
    }

    @Override
    public String getRailName() {
        return "MockRail";
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Set health status (for testing failure scenarios).
     */
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    /**
     * Reject payouts while balance queries keep working (for testing failures after
     * local checks have passed).
     */
    public void setRejectPayouts(boolean rejectPayouts) {
        this.rejectPayouts = rejectPayouts;
    }

    /**
     * Overwrite the custody balance, e.g. to simulate funds moved outside the vault.
     */
    public synchronized void setCustodyBalance(BigDecimal balance) {
        this.custodyBalance = balance;
    }

    /**
     * Give an external wallet reserve currency to onboard with.
     */
    public void fundWallet(String principal, BigDecimal amount) {
        walletBalances.merge(principal, amount, BigDecimal::add);
    }

    public BigDecimal getWalletBalance(String principal) {
        return walletBalances.getOrDefault(principal, BigDecimal.ZERO);
    }

    public int getPayoutCount() {
        return payouts.size();
    }

    public boolean hasPayout(String referenceId) {
        return payouts.containsKey(referenceId);
    }

    /**
     * Clear all state (for test cleanup).
     */
    public synchronized void reset() {
        custodyBalance = initialCustodyBalance;
        walletBalances.clear();
        payouts.clear();
        collections.clear();
        healthy = true;
        rejectPayouts = false;
    }

    private void requireHealthy(String referenceId, String operation) {
        if (!healthy) {
            throw new SettlementRailException("Settlement rail unavailable", referenceId, operation);
        }
    }

    /**
     * Internal class to track a completed movement.
     */
    private static class Movement {
        final String counterparty;
        final BigDecimal amount;
        final String confirmation;

        Movement(String counterparty, BigDecimal amount) {
            this.counterparty = counterparty;
            this.amount = amount;
            this.confirmation = UUID.randomUUID().toString();
        }
    }
}
