package com.coopvault.settlement;

import com.coopvault.common.exception.CoopVaultException;
import com.coopvault.common.exception.ErrorKind;

/**
 * Exception thrown when the settlement rail fails.
 *
 * Always retryable: the operation that called the rail is rolled back as a whole.
 */
public class SettlementRailException extends CoopVaultException {

    private final String referenceId;
    private final String operation;

    public SettlementRailException(String message, String referenceId, String operation) {
        super(ErrorKind.SETTLEMENT_UNAVAILABLE, message);
        this.referenceId = referenceId;
        this.operation = operation;
    }

    public SettlementRailException(String message, String referenceId, String operation, Throwable cause) {
        super(ErrorKind.SETTLEMENT_UNAVAILABLE, message, cause);
        this.referenceId = referenceId;
        this.operation = operation;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public String getOperation() {
        return operation;
    }
}
