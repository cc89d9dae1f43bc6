package com.coopvault.common.exception;

/**
 * Thrown when a redemption, proposal or other record does not exist.
 */
public class NotFoundException extends CoopVaultException {

    public NotFoundException(String type, String id) {
        super(ErrorKind.NOT_FOUND, type + " not found: " + id);
    }
}
