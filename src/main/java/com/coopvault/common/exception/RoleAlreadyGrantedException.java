package com.coopvault.common.exception;

/**
 * Thrown when granting a role the principal already holds.
 */
public class RoleAlreadyGrantedException extends CoopVaultException {

    public RoleAlreadyGrantedException(String principal, String role) {
        super(ErrorKind.ROLE_ALREADY_GRANTED, principal + " already holds role " + role);
    }
}
