package com.coopvault.common.exception;

/**
 * Thrown for a missing, non-positive or over-precise amount.
 */
public class InvalidAmountException extends CoopVaultException {

    public InvalidAmountException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
