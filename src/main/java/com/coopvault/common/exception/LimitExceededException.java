package com.coopvault.common.exception;

/**
 * Thrown when a redemption is declined by a cap.
 */
public class LimitExceededException extends CoopVaultException {

    public LimitExceededException(ErrorKind kind, String reason) {
        super(kind, reason);
    }
}
