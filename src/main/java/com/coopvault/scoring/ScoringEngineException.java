package com.coopvault.scoring;

import com.coopvault.common.exception.CoopVaultException;
import com.coopvault.common.exception.ErrorKind;

/**
 * Exception thrown when a scoring engine cannot produce an evaluation.
 *
 * Retryable: the proposal stays SUBMITTED and can be re-evaluated.
 */
public class ScoringEngineException extends CoopVaultException {

    private final String engine;

    public ScoringEngineException(String message, String engine) {
        super(ErrorKind.SCORING_UNAVAILABLE, message);
        this.engine = engine;
    }

    public ScoringEngineException(String message, String engine, Throwable cause) {
        super(ErrorKind.SCORING_UNAVAILABLE, message, cause);
        this.engine = engine;
    }

    public String getEngine() {
        return engine;
    }
}
