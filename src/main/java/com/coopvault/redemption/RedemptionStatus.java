package com.coopvault.redemption;

/**
 * Redemption lifecycle. Only PENDING requests move; every other status is final for
 * fulfil, cancel and forfeit.
 */
public enum RedemptionStatus {
    /**
     * Units escrowed in the vault, awaiting an operator.
     */
    PENDING,

    /**
     * Units burned and reserve currency paid out.
     */
    FULFILLED,

    /**
     * Units returned to the requester, or resolved through the emergency path.
     */
    CANCELLED,

    /**
     * Units burned without payout.
     */
    FORFEITED
}
