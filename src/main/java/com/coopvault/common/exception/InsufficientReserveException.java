package com.coopvault.common.exception;

import com.coopvault.common.Money;

/**
 * Thrown when the vault cannot cover an outflow: live custody balance, cached
 * reserve figure or vault reserve-unit balance, depending on the kind.
 */
public class InsufficientReserveException extends CoopVaultException {

    public InsufficientReserveException(ErrorKind kind, Money required, Money available) {
        super(kind, String.format("%s: required %s, available %s",
            describe(kind), required, available));
    }

    private static String describe(ErrorKind kind) {
        return switch (kind) {
            case INSUFFICIENT_CUSTODY_BALANCE -> "Insufficient custody balance";
            case INSUFFICIENT_CACHED_RESERVE -> "Insufficient cached reserve";
            default -> "Insufficient vault balance";
        };
    }
}
