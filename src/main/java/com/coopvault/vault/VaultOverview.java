package com.coopvault.vault;

import com.coopvault.common.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of the vault for operator screens.
 */
@Value
@Builder
public class VaultOverview {
    String coopId;
    Money vaultBalance;
    Money totalSupply;
    Money cachedExternalReserve;

    /**
     * Live rail balance, null when the rail could not be reached.
     */
    Money custodyBalance;

    Money maxRedemptionPerUser;
    Money maxDailyRedemptions;
    Money dailyRedeemedAmount;
    Instant dailyWindowStart;
    String clearingAccount;
}
