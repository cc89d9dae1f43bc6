package com.coopvault.treasury;

import com.coopvault.common.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a treasury withdrawal.
 */
@Value
@Builder
public class TreasuryWithdrawal {
    String reference;
    String destination;
    Money amount;
    String actor;
    boolean emergency;
    Instant executedAt;
}
