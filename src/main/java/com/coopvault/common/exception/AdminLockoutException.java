package com.coopvault.common.exception;

/**
 * Thrown when a role change would leave the system without any admin.
 */
public class AdminLockoutException extends CoopVaultException {

    public AdminLockoutException(String principal) {
        super(ErrorKind.WOULD_LEAVE_WITHOUT_ADMIN,
            "Revoking admin from " + principal + " would leave no admin");
    }
}
