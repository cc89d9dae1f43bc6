package com.coopvault.ledger;

/**
 * Types of reserve-unit movements recorded in the ledger.
 */
public enum TransactionType {
    /**
     * New units issued to an account (onboarding).
     */
    MINT,

    /**
     * Units destroyed (fulfilment or forfeiture).
     */
    BURN,

    /**
     * Units moved between two accounts (escrow, cancel, withdrawals).
     */
    TRANSFER
}
