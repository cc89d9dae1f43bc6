package com.coopvault.common.exception;

/**
 * Thrown when an outflow or role change names a blank destination.
 */
public class InvalidDestinationException extends CoopVaultException {

    public InvalidDestinationException(String operation) {
        super(ErrorKind.ZERO_ADDRESS, "Destination cannot be empty for " + operation);
    }
}
