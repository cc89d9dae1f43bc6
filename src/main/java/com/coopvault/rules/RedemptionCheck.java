package com.coopvault.rules;

import com.coopvault.common.Money;
import com.coopvault.vault.VaultReserve;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Input to the redemption rules: the request plus the locked vault state it is
 * checked against.
 */
@Value
@Builder
public class RedemptionCheck {
    String requester;
    Money amount;
    VaultReserve reserve;
    Instant now;
    Duration dailyWindow;
}
