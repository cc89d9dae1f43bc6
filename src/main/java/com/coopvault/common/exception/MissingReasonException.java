package com.coopvault.common.exception;

/**
 * Thrown when an operation that must be justified is called without a reason.
 */
public class MissingReasonException extends CoopVaultException {

    public MissingReasonException(String operation) {
        super(ErrorKind.REASON_REQUIRED, "A reason is required to " + operation);
    }
}
