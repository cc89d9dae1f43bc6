package com.coopvault.vault;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-coop vault state: cached external reserve, redemption caps and the daily window.
 *
 * The cached reserve is NOT the custody balance. It only moves through an explicit
 * resync, onboarding, fulfilment and reserve-currency withdrawal, and may diverge from
 * the rail until resynced. The vault's reserve-unit holdings live in the ledger.
 *
 * Every redemption locks this row, so it is the single serialization point for the
 * daily aggregate.
 */
@Entity
@Table(name = "vault_reserves")
@Data
@NoArgsConstructor
public class VaultReserve {

    @Id
    private String coopId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "cached_reserve_amount", precision = 38, scale = 6)),
        @AttributeOverride(name = "currency", column = @Column(name = "cached_reserve_currency"))
    })
    private Money cachedExternalReserve;

    /**
     * Largest single redemption, zero for unlimited.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "max_per_user_amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "max_per_user_currency"))
    })
    private Money maxRedemptionPerUser;

    /**
     * Aggregate redemptions allowed per daily window, zero for unlimited.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "max_daily_amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "max_daily_currency"))
    })
    private Money maxDailyRedemptions;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "daily_redeemed_amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "daily_redeemed_currency"))
    })
    private Money dailyRedeemedAmount;

    @Column(name = "daily_window_start")
    private Instant dailyWindowStart;

    private String clearingAccount;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public VaultReserve(String coopId, Money maxRedemptionPerUser, Money maxDailyRedemptions) {
        this.coopId = coopId;
        this.cachedExternalReserve = Money.zero(Currency.USDC);
        this.maxRedemptionPerUser = maxRedemptionPerUser;
        this.maxDailyRedemptions = maxDailyRedemptions;
        this.dailyRedeemedAmount = Money.zero(Currency.UC);
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean hasPerUserCap() {
        return maxRedemptionPerUser.isPositive();
    }

    public boolean hasDailyCap() {
        return maxDailyRedemptions.isPositive();
    }

    /**
     * Whether the fixed window that started at {@link #dailyWindowStart} is over.
     * A vault that never redeemed has no open window.
     */
    public boolean isWindowExpired(Instant now, Duration window) {
        return dailyWindowStart == null
            || Duration.between(dailyWindowStart, now).compareTo(window) >= 0;
    }

    /**
     * Aggregate that a redemption at {@code now} is checked against.
     */
    public Money effectiveDailyAggregate(Instant now, Duration window) {
        return isWindowExpired(now, window) ? Money.zero(Currency.UC) : dailyRedeemedAmount;
    }

    /**
     * Add an accepted redemption to the daily aggregate, opening a new window first
     * if the current one is over.
     */
    public void recordRedemption(Money amount, Instant now, Duration window) {
        if (isWindowExpired(now, window)) {
            this.dailyWindowStart = now;
            this.dailyRedeemedAmount = Money.zero(Currency.UC);
        }
        this.dailyRedeemedAmount = dailyRedeemedAmount.add(amount);
        this.updatedAt = now;
    }

    public void creditCachedReserve(Money amount) {
        this.cachedExternalReserve = cachedExternalReserve.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debitCachedReserve(Money amount) {
        this.cachedExternalReserve = cachedExternalReserve.subtract(amount);
        this.updatedAt = Instant.now();
    }

    /**
     * Debit the cached reserve, flooring at zero when the figure has drifted below
     * the amount actually paid.
     */
    public void debitCachedReserveFloored(Money amount) {
        if (cachedExternalReserve.isLessThan(amount)) {
            this.cachedExternalReserve = Money.zero(Currency.USDC);
        } else {
            this.cachedExternalReserve = cachedExternalReserve.subtract(amount);
        }
        this.updatedAt = Instant.now();
    }
}
