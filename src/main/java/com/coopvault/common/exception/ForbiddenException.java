package com.coopvault.common.exception;

/**
 * Thrown when the caller lacks the capability an operation requires.
 */
public class ForbiddenException extends CoopVaultException {

    public ForbiddenException(String caller, String operation) {
        super(ErrorKind.FORBIDDEN,
            String.format("Caller %s is not allowed to %s", caller, operation));
    }
}
