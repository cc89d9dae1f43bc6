package com.coopvault.common.exception;

/**
 * Thrown when attempting an operation on a record in a state that does not allow it.
 */
public class InvalidStateException extends CoopVaultException {

    public InvalidStateException(ErrorKind kind, String type, String id,
                                 String currentState, String operation) {
        super(kind, String.format("Cannot perform operation '%s' on %s %s in state %s",
            operation, type, id, currentState));
    }
}
