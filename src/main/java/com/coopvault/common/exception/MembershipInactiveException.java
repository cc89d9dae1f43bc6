package com.coopvault.common.exception;

/**
 * Thrown when an operation requires the recipient to be an active member.
 */
public class MembershipInactiveException extends CoopVaultException {

    public MembershipInactiveException(String principal, String operation) {
        super(ErrorKind.MEMBERSHIP_INACTIVE,
            String.format("Cannot %s: %s is not an active member", operation, principal));
    }
}
