package com.coopvault.common.exception;

import com.coopvault.common.Money;

/**
 * Thrown when a ledger account holds less than an operation needs.
 */
public class InsufficientFundsException extends CoopVaultException {

    public InsufficientFundsException(String account, Money required, Money available) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in account %s. Required: %s, Available: %s",
                account, required, available));
    }
}
